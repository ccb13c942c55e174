/* (C)2026 */
package com.ammann.fleetsync.service;

import com.ammann.fleetsync.config.FleetConfig;
import com.ammann.fleetsync.model.Container;
import com.ammann.fleetsync.model.ContainerStatus;
import com.ammann.fleetsync.model.Deployment;
import com.ammann.fleetsync.model.Host;
import com.ammann.fleetsync.persistence.FleetSession;
import com.ammann.fleetsync.runtime.ImageReference;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;

/**
 * Refreshes a deployment: reconciles each of its hosts, relinks the containers running its image
 * there and probes their health.
 */
@ApplicationScoped
public class DeploymentSynchronizer {

    @Inject StateReconciler stateReconciler;

    @Inject HealthProber healthProber;

    @Inject FleetConfig config;

    @Inject Logger logger;

    /**
     * Synchronizes one deployment. Nothing is committed here.
     *
     * @param session    the unit of work to record changes in
     * @param deployment the deployment to refresh
     */
    public void synchronize(FleetSession session, Deployment deployment) {
        logger.infof("Synchronizing deployment %s", deployment.key());
        refreshHosts(session, deployment);
        List<Container> linked = linkContainers(session, deployment);
        probe(session, deployment, linked);
    }

    private void refreshHosts(FleetSession session, Deployment deployment) {
        for (String hostKey : deployment.getHostKeys()) {
            Optional<Host> host = session.host(hostKey);
            if (host.isEmpty()) {
                logger.warnf(
                        "Deployment %s references unknown host %s", deployment.key(), hostKey);
                continue;
            }
            try {
                stateReconciler.reconcile(session, host.get());
            } catch (RuntimeException e) {
                logger.errorf(
                        e,
                        "Error refreshing %s for deployment %s",
                        host.get().displayName(),
                        deployment.key());
            }
        }
    }

    private List<Container> linkContainers(FleetSession session, Deployment deployment) {
        String imageRef =
                ImageReference.of(
                        config.registry().user(),
                        deployment.getAppName(),
                        deployment.getImageTag());

        List<Container> linked = new ArrayList<>();
        for (Container container : session.containersByImageRef(imageRef)) {
            if (deployment.getHostKeys().contains(container.getHostKey())) {
                logger.infof(
                        "Linking container %s to deployment %s",
                        container.getId(), deployment.key());
                linked.add(container);
            }
        }
        deployment.replaceContainers(linked.stream().map(Container::getId).toList());
        session.add(deployment);
        return linked;
    }

    private void probe(FleetSession session, Deployment deployment, List<Container> containers) {
        for (Container container : containers) {
            Optional<Host> host = session.host(container.getHostKey());
            ContainerStatus status =
                    host.isPresent()
                            ? healthProber.check(container, host.get(), deployment)
                            : ContainerStatus.DOWN;
            container.setStatus(status);
            session.add(container);
        }
    }
}
