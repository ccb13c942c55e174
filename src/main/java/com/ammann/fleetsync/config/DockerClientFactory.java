/* (C)2026 */
package com.ammann.fleetsync.config;

import com.ammann.fleetsync.model.Host;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.jboss.logging.Logger;

/**
 * Creates and caches one Docker API client per fleet host.
 *
 * <p>Each client talks to {@code tcp://hostname:port} over an Apache HTTP transport. TLS
 * verification and the client certificate directory are shared by all hosts and come from
 * {@code fleet.docker.*}.
 */
@ApplicationScoped
public class DockerClientFactory {

    @Inject FleetConfig config;

    @Inject Logger logger;

    private final Map<String, DockerClient> clients = new ConcurrentHashMap<>();

    /**
     * Returns the Docker client for a host, creating it on first use.
     *
     * @param host the target host
     * @return a configured Docker client ready for API calls
     */
    public DockerClient clientFor(Host host) {
        return clients.computeIfAbsent(host.key(), key -> create(host));
    }

    /**
     * Builds the daemon URI for a host.
     *
     * @param host the target host
     * @return {@code tcp://hostname:port}
     */
    static String dockerHost(Host host) {
        return "tcp://" + host.getHostname() + ":" + host.getPort();
    }

    private DockerClient create(Host host) {
        FleetConfig.Docker docker = config.docker();
        DefaultDockerClientConfig.Builder configBuilder =
                DefaultDockerClientConfig.createDefaultConfigBuilder()
                        .withDockerHost(dockerHost(host))
                        .withDockerTlsVerify(docker.tlsVerify());
        docker.certPath().ifPresent(configBuilder::withDockerCertPath);
        DockerClientConfig clientConfig = configBuilder.build();

        DockerHttpClient httpClient =
                new ApacheDockerHttpClient.Builder()
                        .dockerHost(clientConfig.getDockerHost())
                        .sslConfig(clientConfig.getSSLConfig())
                        .maxConnections(20)
                        .connectionTimeout(docker.connectTimeout())
                        .responseTimeout(docker.responseTimeout())
                        .build();

        logger.debugf("Created Docker client for %s (tls=%s)", dockerHost(host), docker.tlsVerify());
        return DockerClientImpl.getInstance(clientConfig, httpClient);
    }

    @PreDestroy
    void closeAll() {
        clients.forEach(
                (key, client) -> {
                    try {
                        client.close();
                    } catch (IOException e) {
                        logger.warnf(e, "Error closing Docker client for %s", key);
                    }
                });
        clients.clear();
    }
}
