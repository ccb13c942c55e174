/* (C)2026 */
package com.ammann.fleetsync.health;

import com.ammann.fleetsync.dto.SyncReport;
import com.ammann.fleetsync.dto.UnitOutcome;
import com.ammann.fleetsync.service.FleetSyncOrchestrator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.Optional;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

/**
 * Readiness probe reflecting the most recent fleet sync pass. Reports down only when the pass
 * was aborted; failed units are exposed as data.
 */
@Readiness
@ApplicationScoped
public class FleetSyncReadinessCheck implements HealthCheck {

    static final String NAME = "fleet-sync";

    @Inject FleetSyncOrchestrator orchestrator;

    @Override
    public HealthCheckResponse call() {
        Optional<SyncReport> last = orchestrator.lastReport();
        if (last.isEmpty()) {
            return HealthCheckResponse.named(NAME).up().withData("lastPass", "none").build();
        }

        SyncReport report = last.get();
        HealthCheckResponseBuilder builder =
                HealthCheckResponse.named(NAME)
                        .status(!report.aborted())
                        .withData("lastPass", report.finishedAt().toString())
                        .withData("succeeded", report.count(UnitOutcome.State.SUCCEEDED))
                        .withData("degraded", report.count(UnitOutcome.State.DEGRADED))
                        .withData("failed", report.count(UnitOutcome.State.FAILED));
        if (report.aborted()) {
            builder.withData("abortCause", report.abortCause());
        }
        return builder.build();
    }
}
