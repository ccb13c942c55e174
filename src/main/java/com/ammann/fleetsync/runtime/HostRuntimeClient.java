/* (C)2026 */
package com.ammann.fleetsync.runtime;

import com.ammann.fleetsync.config.DockerClientFactory;
import com.ammann.fleetsync.config.FleetConfig;
import com.ammann.fleetsync.model.Host;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.PortBinding;
import com.github.dockerjava.api.model.Ports;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;

/**
 * Container lifecycle operations against one fleet host.
 *
 * <p>Every call resolves the host's Docker client through {@link DockerClientFactory}. Failures
 * surface as docker-java's runtime exceptions; callers decide whether a failure isolates to the
 * host or aborts their loop.
 */
@ApplicationScoped
public class HostRuntimeClient {

    /** Label carrying the key of the deployment a container was launched for. */
    public static final String DEPLOYMENT_LABEL = "fleet.deployment";

    /** Label carrying the encoded manifest of a launched deployment. */
    public static final String MANIFEST_LABEL = "fleet.manifest";

    private static final String IMAGE_ID_ALGORITHM = "sha256:";

    @Inject DockerClientFactory clientFactory;

    @Inject FleetConfig config;

    @Inject Logger logger;

    /**
     * Takes a snapshot of every container on the host, stopped ones included.
     *
     * <p>Containers that disappear between listing and inspection are left out.
     *
     * @param host the host to query
     * @return one descriptor per container, in daemon order
     */
    public List<ContainerDescriptor> snapshot(Host host) {
        DockerClient docker = clientFactory.clientFor(host);
        List<Container> containers = docker.listContainersCmd().withShowAll(true).exec();

        List<ContainerDescriptor> snapshot = new ArrayList<>(containers.size());
        for (Container container : containers) {
            try {
                InspectContainerResponse inspect =
                        docker.inspectContainerCmd(container.getId()).exec();
                snapshot.add(toDescriptor(container, inspect));
            } catch (NotFoundException e) {
                logger.debugf(
                        "Container %s vanished from %s during snapshot",
                        container.getId(), host.displayName());
            }
        }
        return snapshot;
    }

    /**
     * Pulls an image, then creates and starts a container from it.
     *
     * @param host    the target host
     * @param image   the image reference, including tag
     * @param name    the container name
     * @param ports   port bindings in {@code hostPort:containerPort} form
     * @param volumes volume bindings in {@code hostPath:containerPath} form
     * @param labels  labels to put on the container
     * @return the id of the started container
     */
    public String createAndStart(
            Host host,
            String image,
            String name,
            List<String> ports,
            List<String> volumes,
            Map<String, String> labels) {
        DockerClient docker = clientFactory.clientFor(host);
        pull(docker, image);

        PortBinding[] portBindings =
                ports.stream().map(PortBinding::parse).toArray(PortBinding[]::new);
        ExposedPort[] exposedPorts = new ExposedPort[portBindings.length];
        for (int i = 0; i < portBindings.length; i++) {
            exposedPorts[i] = portBindings[i].getExposedPort();
        }
        Bind[] binds = volumes.stream().map(Bind::parse).toArray(Bind[]::new);

        CreateContainerCmd createCmd =
                docker.createContainerCmd(image)
                        .withName(name)
                        .withLabels(labels)
                        .withExposedPorts(exposedPorts)
                        .withHostConfig(
                                HostConfig.newHostConfig()
                                        .withPortBindings(new Ports(portBindings))
                                        .withBinds(binds));

        String containerId = createCmd.exec().getId();
        logger.infof("Created container %s (%s) on %s", name, containerId, host.displayName());

        docker.startContainerCmd(containerId).exec();
        logger.infof("Started container %s on %s", containerId, host.displayName());
        return containerId;
    }

    /**
     * Starts a deployment on a host after its dependencies, depth-first.
     *
     * @param host     the target host
     * @param manifest the deployment and its transitive dependencies
     * @param encoded  the serialized manifest, stored as a label on the top-level container
     * @return the ids of every container started, dependencies first
     */
    public List<String> deployWithDependencies(
            Host host, DeploymentManifest manifest, String encoded) {
        List<String> started = new ArrayList<>();
        for (DeploymentManifest dependency : manifest.dependencies()) {
            started.addAll(deployWithDependencies(host, dependency, null));
        }
        Map<String, String> labels =
                encoded == null
                        ? Map.of(DEPLOYMENT_LABEL, manifest.deployment())
                        : Map.of(DEPLOYMENT_LABEL, manifest.deployment(), MANIFEST_LABEL, encoded);
        started.add(
                createAndStart(
                        host,
                        manifest.image(),
                        manifest.containerName(),
                        manifest.ports(),
                        manifest.volumes(),
                        labels));
        return started;
    }

    /**
     * Stops a container. A container that is already stopped is not an error.
     *
     * @param host        the host running the container
     * @param containerId the container id
     */
    public void stop(Host host, String containerId) {
        logger.infof("Stopping container %s on %s", containerId, host.displayName());
        try {
            clientFactory.clientFor(host).stopContainerCmd(containerId).withTimeout(10).exec();
        } catch (NotModifiedException e) {
            logger.infof("Container %s was already stopped", containerId);
        }
    }

    /**
     * Removes a stopped container.
     *
     * @param host        the host owning the container
     * @param containerId the container id
     */
    public void remove(Host host, String containerId) {
        logger.infof("Removing container %s from %s", containerId, host.displayName());
        clientFactory.clientFor(host).removeContainerCmd(containerId).exec();
    }

    /**
     * Retrieves the last lines of a container's stdout and stderr.
     *
     * @param host        the host running the container
     * @param containerId the container id
     * @param tailLines   the maximum number of trailing lines
     * @return the concatenated log output
     */
    public String logs(Host host, String containerId, int tailLines) {
        StringBuilder logs = new StringBuilder();

        ResultCallback.Adapter<Frame> callback =
                new ResultCallback.Adapter<>() {
                    @Override
                    public void onNext(Frame frame) {
                        logs.append(new String(frame.getPayload()));
                    }
                };

        try {
            boolean completed =
                    clientFactory
                            .clientFor(host)
                            .logContainerCmd(containerId)
                            .withStdOut(true)
                            .withStdErr(true)
                            .withTail(tailLines)
                            .exec(callback)
                            .awaitCompletion(
                                    config.docker().responseTimeout().toMillis(),
                                    TimeUnit.MILLISECONDS);
            if (!completed) {
                throw new IllegalStateException(
                        "Logs of " + containerId + " did not finish within "
                                + config.docker().responseTimeout());
            }
            return logs.toString();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while fetching logs of " + containerId, e);
        }
    }

    private void pull(DockerClient docker, String image) {
        FleetConfig.Registry registry = config.registry();
        AuthConfig auth =
                new AuthConfig()
                        .withRegistryAddress(registry.url())
                        .withUsername(registry.user())
                        .withPassword(registry.password().orElse(null));

        logger.infof("Pulling image %s", image);
        try {
            boolean completed =
                    docker.pullImageCmd(image)
                            .withAuthConfig(auth)
                            .exec(new PullImageResultCallback())
                            .awaitCompletion(
                                    config.docker().pullTimeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                throw new IllegalStateException(
                        "Pull of " + image + " did not finish within "
                                + config.docker().pullTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pulling " + image, e);
        }
    }

    private static ContainerDescriptor toDescriptor(
            Container container, InspectContainerResponse inspect) {
        var state = inspect.getState();
        String runtimeState =
                state != null && state.getStatus() != null
                        ? state.getStatus()
                        : container.getState();
        return new ContainerDescriptor(
                container.getId(),
                runtimeState,
                stripAlgorithm(container.getImageId()),
                container.getImage(),
                state == null ? null : state.getStartedAt(),
                state == null ? null : state.getFinishedAt(),
                container.getCommand());
    }

    static String stripAlgorithm(String imageId) {
        if (imageId != null && imageId.startsWith(IMAGE_ID_ALGORITHM)) {
            return imageId.substring(IMAGE_ID_ALGORITHM.length());
        }
        return imageId;
    }
}
