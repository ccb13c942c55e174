/* (C)2026 */
package com.ammann.fleetsync.service;

import com.ammann.fleetsync.config.FleetConfig;
import com.ammann.fleetsync.exception.HealthProbeException;
import com.ammann.fleetsync.model.Container;
import com.ammann.fleetsync.model.ContainerStatus;
import com.ammann.fleetsync.model.Deployment;
import com.ammann.fleetsync.model.Host;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.core5.util.Timeout;
import org.jboss.logging.Logger;

/**
 * Determines whether the application inside a container answers on its status endpoint.
 *
 * <p>Only request-level failures (timeouts, refused connections) are retried. A response of any
 * kind is final: 2xx and 3xx mean {@link ContainerStatus#UP}, anything else
 * {@link ContainerStatus#DOWN}.
 */
@ApplicationScoped
public class HealthProber {

    @Inject HttpClient httpClient;

    @Inject FleetConfig config;

    @Inject Logger logger;

    Sleeper sleeper = Sleeper.system();

    /**
     * Derives the status of one container of a deployment. Containers that are not running are
     * down without a network call. An exhausted probe, a malformed status URL or any other
     * failure of the request is logged and counts as down.
     *
     * @param container  the container to check
     * @param host       the host the container runs on
     * @param deployment the deployment defining the status port and endpoint
     * @return the derived status
     */
    public ContainerStatus check(Container container, Host host, Deployment deployment) {
        if (!container.isRunning()) {
            return ContainerStatus.DOWN;
        }
        String url =
                statusUrl(
                        host.getHostname(),
                        deployment.getStatusPort(),
                        deployment.getStatusEndpoint());
        logger.infof("Checking status of %s for container: %s", url, container.getId());
        try {
            ContainerStatus status = probe(url);
            logger.infof("Got status of %s for container: %s", status, container.getId());
            return status;
        } catch (HealthProbeException e) {
            logger.warnf(e, "Failed to check status of container %s", container.getId());
            return ContainerStatus.DOWN;
        } catch (RuntimeException e) {
            logger.warnf(
                    e, "Could not check status of container %s at %s", container.getId(), url);
            return ContainerStatus.DOWN;
        }
    }

    /**
     * Issues GET requests against a status URL until one of them gets a response.
     *
     * @param url the status URL
     * @return the status derived from the first response received
     * @throws HealthProbeException if no attempt received a response
     */
    public ContainerStatus probe(String url) {
        FleetConfig.Probe policy = config.probe();
        int attempts = Math.max(1, policy.attempts());
        Timeout timeout = Timeout.ofMilliseconds(policy.timeout().toMillis());
        IOException lastFailure = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            HttpGet request = new HttpGet(url);
            request.setConfig(
                    RequestConfig.custom()
                            .setConnectionRequestTimeout(timeout)
                            .setResponseTimeout(timeout)
                            .build());
            try {
                int code = httpClient.execute(request, response -> response.getCode());
                return code >= 200 && code < 400 ? ContainerStatus.UP : ContainerStatus.DOWN;
            } catch (IOException e) {
                lastFailure = e;
                logger.warnf(
                        "Failed to check status of: %s (attempt %d/%d), reason: [%s]",
                        url, attempt, attempts, e.getMessage());
            }
            if (attempt < attempts) {
                pause(url, attempt);
            }
        }
        throw new HealthProbeException(url, attempts, lastFailure);
    }

    /**
     * Builds a status URL.
     *
     * @param hostname the host the container runs on
     * @param port     the status port
     * @param endpoint the status path, with or without a leading slash
     * @return {@code http://hostname:port/endpoint}
     */
    static String statusUrl(String hostname, int port, String endpoint) {
        String path = endpoint == null ? "" : endpoint;
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        return "http://" + hostname + ":" + port + "/" + path;
    }

    private void pause(String url, int attempt) {
        try {
            sleeper.sleep(config.probe().pause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HealthProbeException(url, attempt, e);
        }
    }
}
