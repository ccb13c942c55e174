/* (C)2026 */
package com.ammann.fleetsync.persistence;

import com.ammann.fleetsync.model.App;
import com.ammann.fleetsync.model.Container;
import com.ammann.fleetsync.model.Deployment;
import com.ammann.fleetsync.model.FleetEntity;
import com.ammann.fleetsync.model.Host;
import com.ammann.fleetsync.model.Image;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Unit of work over an {@link InMemoryFleetStore}.
 *
 * <p>Keeps an identity map per entity type so repeated lookups within a unit return the same
 * working copy. Commit writes back only the entities registered through {@link #add} and removes
 * those passed to {@link #delete}; rows the session merely read are left as the store has them.
 * Both commit and rollback clear the identity map.
 */
class InMemoryFleetSession implements FleetSession {

    private final InMemoryFleetStore store;
    private final Map<Class<?>, Map<String, FleetEntity<?>>> attached = new HashMap<>();
    private final Map<Class<?>, Set<String>> dirty = new HashMap<>();
    private final Map<Class<?>, Set<String>> deleted = new HashMap<>();
    private boolean closed;

    InMemoryFleetSession(InMemoryFleetStore store) {
        this.store = store;
    }

    @Override
    public List<App> apps() {
        return findAll(App.class);
    }

    @Override
    public Optional<App> app(String name) {
        return find(App.class, name);
    }

    @Override
    public List<Image> images() {
        return findAll(Image.class);
    }

    @Override
    public Optional<Image> image(String id) {
        return find(Image.class, id);
    }

    @Override
    public List<Deployment> deployments() {
        return findAll(Deployment.class);
    }

    @Override
    public Optional<Deployment> deployment(String key) {
        return find(Deployment.class, key);
    }

    @Override
    public List<Host> hosts() {
        return findAll(Host.class);
    }

    @Override
    public Optional<Host> host(String key) {
        return find(Host.class, key);
    }

    @Override
    public List<Container> containers() {
        return findAll(Container.class);
    }

    @Override
    public Optional<Container> container(String id) {
        return find(Container.class, id);
    }

    @Override
    public void add(FleetEntity<?> entity) {
        ensureOpen();
        attached(entity.getClass()).put(entity.key(), entity);
        keys(dirty, entity.getClass()).add(entity.key());
        deletedKeys(entity.getClass()).remove(entity.key());
    }

    @Override
    public void delete(FleetEntity<?> entity) {
        ensureOpen();
        attached(entity.getClass()).remove(entity.key());
        keys(dirty, entity.getClass()).remove(entity.key());
        deletedKeys(entity.getClass()).add(entity.key());
    }

    @Override
    public void commit() {
        ensureOpen();
        Map<Class<?>, Map<String, FleetEntity<?>>> saved = new HashMap<>();
        dirty.forEach(
                (type, keys) -> {
                    Map<String, FleetEntity<?>> rows = new LinkedHashMap<>();
                    keys.forEach(key -> rows.put(key, attached(type).get(key)));
                    saved.put(type, rows);
                });
        store.apply(saved, deleted);
        clear();
    }

    @Override
    public void rollback() {
        ensureOpen();
        clear();
    }

    @Override
    public void close() {
        if (!closed) {
            clear();
            closed = true;
        }
    }

    private <T extends FleetEntity<T>> Optional<T> find(Class<T> type, String key) {
        ensureOpen();
        if (key == null || deletedKeys(type).contains(key)) {
            return Optional.empty();
        }
        Map<String, FleetEntity<?>> identityMap = attached(type);
        FleetEntity<?> cached = identityMap.get(key);
        if (cached != null) {
            return Optional.of(type.cast(cached));
        }
        Optional<T> loaded = store.load(type, key);
        loaded.ifPresent(entity -> identityMap.put(key, entity));
        return loaded;
    }

    private <T extends FleetEntity<T>> List<T> findAll(Class<T> type) {
        ensureOpen();
        Map<String, FleetEntity<?>> identityMap = attached(type);
        Set<String> gone = deletedKeys(type);
        List<T> result = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (T row : store.loadAll(type)) {
            if (gone.contains(row.key())) {
                continue;
            }
            FleetEntity<?> cached = identityMap.putIfAbsent(row.key(), row);
            result.add(cached == null ? row : type.cast(cached));
            seen.add(row.key());
        }
        // added in this session, not yet committed
        for (FleetEntity<?> entity : identityMap.values()) {
            if (!seen.contains(entity.key())) {
                result.add(type.cast(entity));
            }
        }
        return result;
    }

    private Map<String, FleetEntity<?>> attached(Class<?> type) {
        return attached.computeIfAbsent(type, ignored -> new LinkedHashMap<>());
    }

    private Set<String> deletedKeys(Class<?> type) {
        return keys(deleted, type);
    }

    private static Set<String> keys(Map<Class<?>, Set<String>> byType, Class<?> type) {
        return byType.computeIfAbsent(type, ignored -> new LinkedHashSet<>());
    }

    private void clear() {
        attached.clear();
        dirty.clear();
        deleted.clear();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Fleet session is closed");
        }
    }
}
