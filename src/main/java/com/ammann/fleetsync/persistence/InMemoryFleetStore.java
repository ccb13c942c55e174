/* (C)2026 */
package com.ammann.fleetsync.persistence;

import com.ammann.fleetsync.exception.FleetStoreException;
import com.ammann.fleetsync.model.App;
import com.ammann.fleetsync.model.Container;
import com.ammann.fleetsync.model.Deployment;
import com.ammann.fleetsync.model.FleetEntity;
import com.ammann.fleetsync.model.Host;
import com.ammann.fleetsync.model.Image;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Process-local {@link FleetStore}.
 *
 * <p>Rows are stored as private copies in insertion order. Sessions read copies and hand their
 * changes back in one atomic {@link #apply} call on commit.
 */
@ApplicationScoped
public class InMemoryFleetStore implements FleetStore {

    static final List<Class<? extends FleetEntity<?>>> ENTITY_TYPES =
            List.of(App.class, Image.class, Deployment.class, Host.class, Container.class);

    private final Map<Class<?>, Map<String, FleetEntity<?>>> tables = new HashMap<>();

    public InMemoryFleetStore() {
        for (Class<?> type : ENTITY_TYPES) {
            tables.put(type, new LinkedHashMap<>());
        }
    }

    @Override
    public FleetSession openSession() {
        return new InMemoryFleetSession(this);
    }

    synchronized <T extends FleetEntity<T>> Optional<T> load(Class<T> type, String key) {
        FleetEntity<?> row = table(type).get(key);
        return Optional.ofNullable(row).map(found -> type.cast(found).copy());
    }

    synchronized <T extends FleetEntity<T>> List<T> loadAll(Class<T> type) {
        List<T> rows = new ArrayList<>();
        for (FleetEntity<?> row : table(type).values()) {
            rows.add(type.cast(row).copy());
        }
        return rows;
    }

    /**
     * Writes a session's changes.
     *
     * @param saved   entities to insert or overwrite, by type and key
     * @param deleted keys to remove, by type
     */
    synchronized void apply(
            Map<Class<?>, Map<String, FleetEntity<?>>> saved, Map<Class<?>, Set<String>> deleted) {
        saved.forEach(
                (type, rows) -> rows.forEach((key, row) -> table(type).put(key, row.copy())));
        deleted.forEach((type, keys) -> keys.forEach(table(type)::remove));
    }

    private Map<String, FleetEntity<?>> table(Class<?> type) {
        Map<String, FleetEntity<?>> table = tables.get(type);
        if (table == null) {
            throw new FleetStoreException("Not a fleet entity type: " + type.getName());
        }
        return table;
    }
}
