/* (C)2026 */
package com.ammann.fleetsync.service;

import com.ammann.fleetsync.config.FleetConfig;
import com.ammann.fleetsync.dto.HostLaunchOutcome;
import com.ammann.fleetsync.dto.LaunchStatus;
import com.ammann.fleetsync.exception.FleetEntityNotFoundException;
import com.ammann.fleetsync.model.Deployment;
import com.ammann.fleetsync.model.Host;
import com.ammann.fleetsync.persistence.FleetSession;
import com.ammann.fleetsync.persistence.FleetStore;
import com.ammann.fleetsync.runtime.DeploymentManifest;
import com.ammann.fleetsync.runtime.HostRuntimeClient;
import com.ammann.fleetsync.runtime.ImageReference;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import org.jboss.logging.Logger;

/**
 * Starts a deployment on each of its hosts, then refreshes it.
 *
 * <p>Launches run on a bounded worker pool; {@link #launch(String)} returns a pending
 * {@link LaunchStatus} that is updated through {@link LaunchTracker} as the launch progresses.
 * The first host that fails aborts the launch: that host is recorded as failed and the remaining
 * ones as skipped.
 */
@ApplicationScoped
public class DeploymentLauncher {

    @Inject FleetStore store;

    @Inject HostRuntimeClient runtimeClient;

    @Inject DeploymentSynchronizer deploymentSynchronizer;

    @Inject LaunchTracker tracker;

    @Inject ObjectMapper objectMapper;

    @Inject FleetConfig config;

    @Inject Logger logger;

    Executor executor;

    private ExecutorService workers;

    @PostConstruct
    void startWorkers() {
        AtomicInteger counter = new AtomicInteger();
        workers =
                Executors.newFixedThreadPool(
                        Math.max(1, config.launch().workers()),
                        runnable -> {
                            Thread thread =
                                    new Thread(
                                            runnable,
                                            "deployment-launcher-" + counter.incrementAndGet());
                            thread.setDaemon(true);
                            return thread;
                        });
        executor = workers;
    }

    @PreDestroy
    void stopWorkers() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    /**
     * Submits a launch of the given deployment.
     *
     * @param deploymentKey the deployment key ({@code app:tag/environment})
     * @return the pending launch status
     * @throws FleetEntityNotFoundException if the deployment does not exist
     * @throws RejectedExecutionException if the worker pool no longer accepts launches; the
     *     registered launch is marked failed first
     */
    public LaunchStatus launch(String deploymentKey) {
        try (FleetSession session = store.openSession()) {
            session.deployment(deploymentKey)
                    .orElseThrow(
                            () -> new FleetEntityNotFoundException("Deployment", deploymentKey));
        }
        LaunchStatus status = tracker.register(deploymentKey);
        logger.infof("Submitted launch %s of deployment %s", status.id(), deploymentKey);
        try {
            executor.execute(() -> run(status.id(), deploymentKey));
        } catch (RejectedExecutionException e) {
            logger.errorf(e, "Launch %s of deployment %s was rejected", status.id(), deploymentKey);
            tracker.update(status.id(), rejected -> rejected.failed(e, Instant.now()));
            throw e;
        }
        return status;
    }

    void run(String launchId, String deploymentKey) {
        tracker.update(launchId, LaunchStatus::running);
        try (FleetSession session = store.openSession()) {
            Deployment deployment =
                    session.deployment(deploymentKey)
                            .orElseThrow(
                                    () ->
                                            new FleetEntityNotFoundException(
                                                    "Deployment", deploymentKey));
            DeploymentManifest manifest = manifest(session, deployment);
            String encoded = encode(manifest);

            logger.infof("Launching deployment %s", deploymentKey);
            launchOnHosts(session, launchId, deployment, manifest, encoded);
            refresh(session, deploymentKey);
        } catch (RuntimeException e) {
            logger.errorf(e, "Launch %s of deployment %s failed", launchId, deploymentKey);
            tracker.update(launchId, status -> status.failed(e, Instant.now()));
            return;
        }
        tracker.update(launchId, status -> status.succeeded(Instant.now()));
        logger.infof("Finished deployment %s", deploymentKey);
    }

    private void launchOnHosts(
            FleetSession session,
            String launchId,
            Deployment deployment,
            DeploymentManifest manifest,
            String encoded) {
        List<String> hostKeys = new ArrayList<>(deployment.getHostKeys());
        for (int i = 0; i < hostKeys.size(); i++) {
            String hostKey = hostKeys.get(i);
            try {
                Host host =
                        session.host(hostKey)
                                .orElseThrow(
                                        () -> new FleetEntityNotFoundException("Host", hostKey));
                logger.infof(
                        "Launching deployment %s on %s", deployment.key(), host.displayName());
                List<String> started =
                        runtimeClient.deployWithDependencies(host, manifest, encoded);
                tracker.update(
                        launchId,
                        status -> status.withHost(HostLaunchOutcome.launched(hostKey, started)));
            } catch (RuntimeException e) {
                List<String> remaining = hostKeys.subList(i + 1, hostKeys.size());
                tracker.update(
                        launchId,
                        status -> {
                            LaunchStatus updated =
                                    status.withHost(HostLaunchOutcome.failed(hostKey, e));
                            for (String skipped : remaining) {
                                updated = updated.withHost(HostLaunchOutcome.skipped(skipped));
                            }
                            return updated;
                        });
                throw e;
            }
        }
    }

    private void refresh(FleetSession session, String deploymentKey) {
        try {
            Deployment deployment =
                    session.deployment(deploymentKey)
                            .orElseThrow(
                                    () ->
                                            new FleetEntityNotFoundException(
                                                    "Deployment", deploymentKey));
            deploymentSynchronizer.synchronize(session, deployment);
            session.commit();
        } catch (RuntimeException e) {
            logger.errorf(e, "Error refreshing deployment %s after launch", deploymentKey);
            session.rollback();
        }
    }

    /**
     * Builds the manifest of a deployment and its transitive dependencies. Each dependency
     * appears once; references back into the chain are dropped.
     */
    DeploymentManifest manifest(FleetSession session, Deployment deployment) {
        return manifest(session, deployment, new HashSet<>());
    }

    private DeploymentManifest manifest(
            FleetSession session, Deployment deployment, Set<String> included) {
        included.add(deployment.key());
        List<DeploymentManifest> dependencies = new ArrayList<>();
        for (String dependencyKey : deployment.getDependencies()) {
            if (!included.add(dependencyKey)) {
                logger.warnf(
                        "Dependency %s of %s already included, skipping",
                        dependencyKey, deployment.key());
                continue;
            }
            Deployment dependency =
                    session.deployment(dependencyKey)
                            .orElseThrow(
                                    () ->
                                            new FleetEntityNotFoundException(
                                                    "Deployment", dependencyKey));
            dependencies.add(manifest(session, dependency, included));
        }
        return new DeploymentManifest(
                deployment.key(),
                ImageReference.of(
                        config.registry().user(),
                        deployment.getAppName(),
                        deployment.getImageTag()),
                deployment.containerName(),
                List.copyOf(deployment.getMappedPorts()),
                List.copyOf(deployment.getMappedVolumes()),
                List.copyOf(dependencies));
    }

    private String encode(DeploymentManifest manifest) {
        try {
            return objectMapper.writeValueAsString(manifest);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Could not encode manifest of " + manifest.deployment(), e);
        }
    }
}
