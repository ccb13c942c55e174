/* (C)2026 */
package com.ammann.fleetsync.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;

/**
 * CDI producer for the HTTP client used against the registry and application status endpoints.
 *
 * <p>Redirects are not followed and automatic retries are disabled: a 3xx status counts as a
 * response in its own right, and the health prober owns its retry policy.
 */
@ApplicationScoped
public class HttpClientProducer {

    @Inject FleetConfig config;

    /**
     * Produces the shared HTTP client whose connect timeout is the probe timeout.
     *
     * @return a pooled HTTP client
     */
    @Produces
    @Singleton
    public CloseableHttpClient httpClient() {
        Timeout timeout = Timeout.ofMilliseconds(config.probe().timeout().toMillis());
        PoolingHttpClientConnectionManager connectionManager =
                PoolingHttpClientConnectionManagerBuilder.create()
                        .setDefaultConnectionConfig(
                                ConnectionConfig.custom()
                                        .setConnectTimeout(timeout)
                                        .setSocketTimeout(timeout)
                                        .build())
                        .setMaxConnTotal(50)
                        .setMaxConnPerRoute(10)
                        .build();

        return HttpClients.custom()
                .setConnectionManager(connectionManager)
                .disableRedirectHandling()
                .disableAutomaticRetries()
                .build();
    }

    void close(@Disposes CloseableHttpClient httpClient) throws IOException {
        httpClient.close();
    }
}
