/* (C)2026 */
package com.ammann.fleetsync.persistence;

import com.ammann.fleetsync.model.App;
import com.ammann.fleetsync.model.Container;
import com.ammann.fleetsync.model.Deployment;
import com.ammann.fleetsync.model.FleetEntity;
import com.ammann.fleetsync.model.Host;
import com.ammann.fleetsync.model.Image;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A transactional unit of work over the fleet entity graph.
 *
 * <p>Entities returned by a session are working copies. A modified entity must be passed to
 * {@link #add} to be saved. Changes become visible to other sessions only after {@link #commit()};
 * {@link #rollback()} discards them. Both detach every entity the
 * session handed out, so callers look entities up again after either call.
 */
public interface FleetSession extends AutoCloseable {

    List<App> apps();

    Optional<App> app(String name);

    List<Image> images();

    Optional<Image> image(String id);

    List<Deployment> deployments();

    Optional<Deployment> deployment(String key);

    List<Host> hosts();

    Optional<Host> host(String key);

    List<Container> containers();

    Optional<Container> container(String id);

    /**
     * Registers a new or modified entity with this unit of work.
     *
     * @param entity the entity to save on commit
     */
    void add(FleetEntity<?> entity);

    /**
     * Schedules an entity for removal on commit.
     *
     * @param entity the entity to remove
     */
    void delete(FleetEntity<?> entity);

    void commit();

    void rollback();

    /** Releases the session. Uncommitted changes are discarded. */
    @Override
    void close();

    default List<Deployment> deploymentsOf(String appName) {
        return deployments().stream()
                .filter(deployment -> deployment.getAppName().equals(appName))
                .toList();
    }

    default List<Container> containersOnHost(String hostKey) {
        return containers().stream()
                .filter(container -> hostKey.equals(container.getHostKey()))
                .toList();
    }

    default List<Container> containersByImageRef(String imageRef) {
        return containers().stream()
                .filter(container -> Objects.equals(imageRef, container.getImageRef()))
                .toList();
    }
}
