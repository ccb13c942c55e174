/* (C)2026 */
package com.ammann.fleetsync.service;

import com.ammann.fleetsync.exception.FleetEntityNotFoundException;
import com.ammann.fleetsync.model.Container;
import com.ammann.fleetsync.model.Host;
import com.ammann.fleetsync.persistence.FleetSession;
import com.ammann.fleetsync.persistence.FleetStore;
import com.ammann.fleetsync.runtime.HostRuntimeClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/**
 * Operator actions on a single known container: stop, remove and log retrieval.
 *
 * <p>Host and container must both be known to the store, and the container must belong to the
 * host; otherwise {@link FleetEntityNotFoundException} is thrown.
 */
@ApplicationScoped
public class HostContainerService {

    @Inject FleetStore store;

    @Inject HostRuntimeClient runtimeClient;

    @Inject Logger logger;

    public void stopContainer(String hostname, int port, String containerId) {
        Host host = resolve(hostname, port, containerId);
        runtimeClient.stop(host, containerId);
    }

    /** Removes the container from its host and forgets it. */
    public void removeContainer(String hostname, int port, String containerId) {
        Host host = resolve(hostname, port, containerId);
        runtimeClient.remove(host, containerId);

        try (FleetSession session = store.openSession()) {
            session.container(containerId)
                    .ifPresent(
                            container -> {
                                unlinkImage(session, container);
                                session.delete(container);
                            });
            session.commit();
        }
        logger.infof("Removed container %s from %s", containerId, host.displayName());
    }

    public String getContainerLogs(String hostname, int port, String containerId, int tail) {
        Host host = resolve(hostname, port, containerId);
        return runtimeClient.logs(host, containerId, tail);
    }

    private Host resolve(String hostname, int port, String containerId) {
        String hostKey = Host.keyOf(hostname, port);
        try (FleetSession session = store.openSession()) {
            Host host =
                    session.host(hostKey)
                            .orElseThrow(() -> new FleetEntityNotFoundException("Host", hostKey));
            session.container(containerId)
                    .filter(container -> hostKey.equals(container.getHostKey()))
                    .orElseThrow(
                            () -> new FleetEntityNotFoundException("Container", containerId));
            return host;
        }
    }

    private void unlinkImage(FleetSession session, Container container) {
        if (container.getImageId() == null) {
            return;
        }
        session.image(container.getImageId())
                .ifPresent(
                        image -> {
                            image.unlinkContainer(container.getId());
                            session.add(image);
                        });
    }
}
