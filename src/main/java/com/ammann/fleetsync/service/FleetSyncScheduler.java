/* (C)2026 */
package com.ammann.fleetsync.service;

import com.ammann.fleetsync.config.FleetConfig;
import com.ammann.fleetsync.dto.SyncReport;
import com.ammann.fleetsync.dto.UnitOutcome;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

/** Triggers fleet sync passes periodically and, if configured, once at startup. */
@ApplicationScoped
public class FleetSyncScheduler {

    @Inject FleetSyncOrchestrator orchestrator;

    @Inject FleetConfig config;

    @Inject Logger logger;

    void onStart(@Observes StartupEvent event) {
        if (config.sync().onStart()) {
            logger.info("Running initial fleet sync pass");
            sync();
        }
    }

    @Scheduled(
            identity = "fleet-sync",
            every = "${fleet.sync.interval:60s}",
            delayed = "${fleet.sync.initial-delay:10s}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void sync() {
        logger.debugf("Starting fleet sync pass...");
        SyncReport report = orchestrator.runPass();

        if (report.aborted()) {
            logger.errorf("Fleet sync pass aborted: %s", report.abortCause());
            return;
        }
        for (UnitOutcome failure : report.failures()) {
            logger.warnf(
                    "%s %s %s: %s",
                    failure.kind(), failure.key(), failure.state(), failure.cause());
        }
        logger.infof(
                "Fleet sync pass finished: %d succeeded, %d degraded, %d failed",
                report.count(UnitOutcome.State.SUCCEEDED),
                report.count(UnitOutcome.State.DEGRADED),
                report.count(UnitOutcome.State.FAILED));
    }
}
