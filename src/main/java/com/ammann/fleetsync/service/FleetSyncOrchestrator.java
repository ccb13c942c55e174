/* (C)2026 */
package com.ammann.fleetsync.service;

import com.ammann.fleetsync.dto.SyncReport;
import com.ammann.fleetsync.dto.UnitOutcome;
import com.ammann.fleetsync.exception.FleetEntityNotFoundException;
import com.ammann.fleetsync.model.App;
import com.ammann.fleetsync.model.Deployment;
import com.ammann.fleetsync.model.Host;
import com.ammann.fleetsync.persistence.FleetSession;
import com.ammann.fleetsync.persistence.FleetStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Runs a full sync pass over the fleet.
 *
 * <p>For every app the images are synchronized, then each of its deployments; afterwards every
 * host is reconciled. Each of these is its own unit of work: it is committed on success and
 * rolled back on failure, and a failure never stops the pass.
 */
@ApplicationScoped
public class FleetSyncOrchestrator {

    @Inject FleetStore store;

    @Inject ImageSynchronizer imageSynchronizer;

    @Inject DeploymentSynchronizer deploymentSynchronizer;

    @Inject StateReconciler stateReconciler;

    @Inject Logger logger;

    private volatile SyncReport lastReport;

    /** Returns the report of the most recent pass, if one has run. */
    public Optional<SyncReport> lastReport() {
        return Optional.ofNullable(lastReport);
    }

    /**
     * Runs one pass.
     *
     * @return the per-unit outcomes of the pass
     */
    public SyncReport runPass() {
        Instant startedAt = Instant.now();
        List<UnitOutcome> outcomes = new ArrayList<>();
        String abortCause = null;

        try (FleetSession session = store.openSession()) {
            logger.info("Updating images and deployments");
            syncApps(session, outcomes);
            logger.info("Updating container information");
            syncHosts(session, outcomes);
        } catch (RuntimeException e) {
            logger.errorf(e, "Fleet sync pass aborted");
            abortCause = UnitOutcome.describe(e);
        }

        SyncReport report = new SyncReport(startedAt, Instant.now(), outcomes, abortCause);
        lastReport = report;
        return report;
    }

    private void syncApps(FleetSession session, List<UnitOutcome> outcomes) {
        List<String> appNames = session.apps().stream().map(App::getName).toList();
        for (String appName : appNames) {
            outcomes.add(
                    runUnit(session, UnitOutcome.Kind.APP, appName, () -> syncApp(session, appName)));

            List<String> deploymentKeys =
                    session.deploymentsOf(appName).stream().map(Deployment::key).toList();
            for (String deploymentKey : deploymentKeys) {
                outcomes.add(
                        runUnit(
                                session,
                                UnitOutcome.Kind.DEPLOYMENT,
                                deploymentKey,
                                () -> syncDeployment(session, deploymentKey)));
            }
        }
    }

    private void syncHosts(FleetSession session, List<UnitOutcome> outcomes) {
        List<String> hostKeys = session.hosts().stream().map(Host::key).toList();
        for (String hostKey : hostKeys) {
            outcomes.add(
                    runUnit(session, UnitOutcome.Kind.HOST, hostKey, () -> syncHost(session, hostKey)));
        }
    }

    private String syncApp(FleetSession session, String appName) {
        App app =
                session.app(appName)
                        .orElseThrow(() -> new FleetEntityNotFoundException("App", appName));
        imageSynchronizer.synchronize(session, app);
        return null;
    }

    private String syncDeployment(FleetSession session, String deploymentKey) {
        Deployment deployment =
                session.deployment(deploymentKey)
                        .orElseThrow(
                                () -> new FleetEntityNotFoundException("Deployment", deploymentKey));
        deploymentSynchronizer.synchronize(session, deployment);
        return null;
    }

    private String syncHost(FleetSession session, String hostKey) {
        Host host =
                session.host(hostKey)
                        .orElseThrow(() -> new FleetEntityNotFoundException("Host", hostKey));
        return stateReconciler.reconcile(session, host) ? null : "host unreachable";
    }

    private UnitOutcome runUnit(
            FleetSession session, UnitOutcome.Kind kind, String key, UnitWork work) {
        try {
            String degradation = work.run();
            session.commit();
            return degradation == null
                    ? UnitOutcome.succeeded(kind, key)
                    : UnitOutcome.degraded(kind, key, degradation);
        } catch (RuntimeException e) {
            logger.errorf(e, "Failed to sync %s %s", kind, key);
            try {
                session.rollback();
            } catch (RuntimeException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
                logger.errorf(rollbackFailure, "Rollback after %s %s failed", kind, key);
            }
            return UnitOutcome.failed(kind, key, e);
        }
    }

    /** One unit of work; returns a degradation note, or {@code null} when fully successful. */
    @FunctionalInterface
    private interface UnitWork {
        String run();
    }
}
