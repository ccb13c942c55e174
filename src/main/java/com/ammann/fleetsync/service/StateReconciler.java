/* (C)2026 */
package com.ammann.fleetsync.service;

import com.ammann.fleetsync.config.FleetConfig;
import com.ammann.fleetsync.model.Container;
import com.ammann.fleetsync.model.Host;
import com.ammann.fleetsync.model.HostStatus;
import com.ammann.fleetsync.persistence.FleetSession;
import com.ammann.fleetsync.runtime.ContainerDescriptor;
import com.ammann.fleetsync.runtime.HostRuntimeClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

/**
 * Makes the persisted containers of a host match a fresh snapshot of that host.
 *
 * <p>Known containers are updated in place, unseen ones are created and containers that are no
 * longer reported are deleted outright. A new container is linked to the image whose layer id
 * equals the first eight characters of its image id, when such an image is known.
 *
 * <p>Nothing is committed here; the caller owns the unit of work.
 */
@ApplicationScoped
public class StateReconciler {

    static final int IMAGE_ID_PREFIX_LENGTH = 8;

    @Inject HostRuntimeClient runtimeClient;

    @Inject FleetConfig config;

    @Inject Logger logger;

    /**
     * Fetches the host's snapshot and applies it.
     *
     * <p>If the snapshot cannot be fetched the host is marked {@link HostStatus#DOWN} and its
     * containers are left untouched.
     *
     * @param session the unit of work to record changes in
     * @param host    the host to refresh
     * @return {@code true} if the snapshot was applied, {@code false} if the host was unreachable
     */
    public boolean reconcile(FleetSession session, Host host) {
        List<ContainerDescriptor> snapshot;
        try {
            snapshot = runtimeClient.snapshot(host);
        } catch (RuntimeException e) {
            logger.errorf(
                    e, "Failed to list containers on %s, marking host down", host.displayName());
            host.setStatus(HostStatus.DOWN);
            session.add(host);
            return false;
        }
        apply(session, host, snapshot);
        return true;
    }

    /**
     * Applies a snapshot to the persisted containers of a host.
     *
     * @param session  the unit of work to record changes in
     * @param host     the host the snapshot was taken from
     * @param snapshot the containers reported by the host
     */
    public void apply(FleetSession session, Host host, List<ContainerDescriptor> snapshot) {
        ZoneId zone = config.timezone().orElseGet(ZoneId::systemDefault);
        List<Container> previous = session.containersOnHost(host.key());
        Set<String> observed = new HashSet<>();

        for (ContainerDescriptor descriptor : snapshot) {
            observed.add(descriptor.id());
            Optional<Container> existing = session.container(descriptor.id());
            if (existing.isPresent()) {
                update(session, host, existing.get(), descriptor, zone);
            } else {
                create(session, host, descriptor, zone);
            }
        }

        for (Container container : previous) {
            if (!observed.contains(container.getId())) {
                logger.infof(
                        "Previous container %s not found on %s, removing",
                        container.getId(), host.displayName());
                delete(session, container);
            }
        }

        if (host.getStatus() != HostStatus.UP) {
            host.setStatus(HostStatus.UP);
            session.add(host);
        }
    }

    private void update(
            FleetSession session,
            Host host,
            Container container,
            ContainerDescriptor descriptor,
            ZoneId zone) {
        LocalDateTime startedAt = LocalTimestamps.toLocal(descriptor.startedAt(), zone);
        LocalDateTime finishedAt = LocalTimestamps.toLocal(descriptor.finishedAt(), zone);

        boolean unchanged =
                host.key().equals(container.getHostKey())
                        && Objects.equals(container.getState(), descriptor.state())
                        && Objects.equals(container.getImageRef(), descriptor.imageRef())
                        && Objects.equals(container.getStartedAt(), startedAt)
                        && Objects.equals(container.getFinishedAt(), finishedAt)
                        && Objects.equals(container.getCommand(), descriptor.command());
        if (unchanged) {
            logger.debugf("Container %s unchanged (%s)", container.getId(), descriptor.state());
            return;
        }

        logger.infof(
                "Found existing container %s, updating state to: %s",
                container.getId(), descriptor.state());
        container.setHostKey(host.key());
        container.setState(descriptor.state());
        container.setImageRef(descriptor.imageRef());
        container.setStartedAt(startedAt);
        container.setFinishedAt(finishedAt);
        container.setCommand(descriptor.command());
        session.add(container);
    }

    private void create(
            FleetSession session, Host host, ContainerDescriptor descriptor, ZoneId zone) {
        logger.infof(
                "Got new container %s on %s, setting state to: %s",
                descriptor.id(), host.displayName(), descriptor.state());

        Container container = new Container(descriptor.id(), host.key());
        container.setState(descriptor.state());
        container.setImageRef(descriptor.imageRef());
        container.setStartedAt(LocalTimestamps.toLocal(descriptor.startedAt(), zone));
        container.setFinishedAt(LocalTimestamps.toLocal(descriptor.finishedAt(), zone));
        container.setCommand(descriptor.command());

        String layer = layerPrefix(descriptor.imageId());
        if (layer != null) {
            session.image(layer)
                    .ifPresent(
                            image -> {
                                container.setImageId(image.getId());
                                image.linkContainer(container.getId());
                                session.add(image);
                            });
        }
        session.add(container);
    }

    private void delete(FleetSession session, Container container) {
        if (container.getImageId() != null) {
            session.image(container.getImageId())
                    .ifPresent(
                            image -> {
                                image.unlinkContainer(container.getId());
                                session.add(image);
                            });
        }
        session.delete(container);
    }

    /**
     * Returns the part of an image id that registry layer ids are matched against.
     *
     * @param imageId the image id reported by the daemon
     * @return the first eight characters, the whole id if shorter, or {@code null}
     */
    static String layerPrefix(String imageId) {
        if (imageId == null || imageId.isBlank()) {
            return null;
        }
        return imageId.length() <= IMAGE_ID_PREFIX_LENGTH
                ? imageId
                : imageId.substring(0, IMAGE_ID_PREFIX_LENGTH);
    }
}
