/* (C)2026 */
package com.ammann.fleetsync.service;

import com.ammann.fleetsync.dto.LaunchStatus;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/** Keeps the status of recent launches so callers can poll them. Oldest entries are evicted. */
@ApplicationScoped
public class LaunchTracker {

    static final int MAX_TRACKED = 200;

    private final Map<String, LaunchStatus> launches =
            new LinkedHashMap<>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, LaunchStatus> eldest) {
                    return size() > MAX_TRACKED;
                }
            };

    public synchronized LaunchStatus register(String deploymentKey) {
        LaunchStatus status =
                LaunchStatus.pending(UUID.randomUUID().toString(), deploymentKey, Instant.now());
        launches.put(status.id(), status);
        return status;
    }

    public synchronized Optional<LaunchStatus> find(String launchId) {
        return Optional.ofNullable(launches.get(launchId));
    }

    /**
     * Replaces a launch's status with a transition of it.
     *
     * @param launchId the launch id
     * @param change   the transition to apply
     * @return the new status, or {@code null} if the launch has been evicted
     */
    public synchronized LaunchStatus update(String launchId, UnaryOperator<LaunchStatus> change) {
        return launches.computeIfPresent(launchId, (id, current) -> change.apply(current));
    }
}
