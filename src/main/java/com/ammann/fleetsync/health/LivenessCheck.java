/* (C)2026 */
package com.ammann.fleetsync.health;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;

/**
 * MicroProfile Health liveness probe for the fleet sync worker.
 *
 * <p>Always reports the worker as alive. Sync outcomes are reported by
 * {@link FleetSyncReadinessCheck}.
 */
@Liveness
public class LivenessCheck implements HealthCheck {

    @Override
    public HealthCheckResponse call() {
        return HealthCheckResponse.up("alive");
    }
}
