/* (C)2026 */
package com.ammann.fleetsync.runtime;

import java.util.List;

/**
 * A deployment together with everything that must run before it, as handed to a host.
 *
 * <p>Dependencies are started depth-first, in list order, before the deployment itself.
 *
 * @param deployment    the deployment key ({@code app:tag/environment})
 * @param image         the image reference to pull and run
 * @param containerName the name given to the created container
 * @param ports         port bindings in {@code hostPort:containerPort} form
 * @param volumes       volume bindings in {@code hostPath:containerPath} form
 * @param dependencies  manifests of the deployments this one depends on
 */
public record DeploymentManifest(
        String deployment,
        String image,
        String containerName,
        List<String> ports,
        List<String> volumes,
        List<DeploymentManifest> dependencies) {}
