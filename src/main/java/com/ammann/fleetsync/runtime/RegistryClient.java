/* (C)2026 */
package com.ammann.fleetsync.runtime;

import com.ammann.fleetsync.config.FleetConfig;
import com.ammann.fleetsync.exception.RegistryException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.hc.client5.http.auth.AuthScope;
import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.auth.BasicAuthCache;
import org.apache.hc.client5.http.impl.auth.BasicCredentialsProvider;
import org.apache.hc.client5.http.impl.auth.BasicScheme;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.jboss.logging.Logger;

/**
 * Reads tag listings from the private registry.
 *
 * <p>Uses the v1 tag endpoint {@code GET /v1/repositories/{user}/{app}/tags}. The body is either
 * an array of {@code {"layer": ..., "name": ...}} entries or an object mapping tag to layer id.
 */
@ApplicationScoped
public class RegistryClient {

    private static final TypeReference<List<RegistryImage>> IMAGE_LIST = new TypeReference<>() {};

    @Inject HttpClient httpClient;

    @Inject ObjectMapper objectMapper;

    @Inject FleetConfig config;

    @Inject Logger logger;

    /**
     * Lists the tags the registry currently holds for an app.
     *
     * @param appName the repository name under the configured registry user
     * @return the tag entries, possibly empty
     * @throws RegistryException if the registry is unreachable, refuses the request, or answers
     *     with a body that is not a tag listing
     */
    public List<RegistryImage> listImages(String appName) {
        String url = tagsUrl(appName);
        HttpGet request = new HttpGet(url);
        request.setConfig(
                RequestConfig.custom()
                        .setResponseTimeout(
                                Timeout.ofMilliseconds(config.registry().timeout().toMillis()))
                        .build());
        HttpClientContext context = HttpClientContext.create();
        config.registry().password().ifPresent(password -> authenticate(context, url, password));

        logger.debugf("Fetching tags from %s", url);
        try {
            return httpClient.execute(
                    request,
                    context,
                    response -> {
                        int code = response.getCode();
                        if (code < 200 || code >= 300) {
                            throw new RegistryException(
                                    "Registry answered " + code + " for " + url);
                        }
                        HttpEntity entity = response.getEntity();
                        if (entity == null) {
                            throw new RegistryException("Registry sent an empty body for " + url);
                        }
                        return parse(EntityUtils.toString(entity, StandardCharsets.UTF_8), url);
                    });
        } catch (IOException e) {
            throw new RegistryException("Registry unreachable: " + url, e);
        }
    }

    /**
     * Builds the tag listing URL for an app.
     *
     * @param appName the repository name
     * @return the absolute URL
     */
    String tagsUrl(String appName) {
        String base = config.registry().url();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/v1/repositories/" + config.registry().user() + "/" + appName + "/tags";
    }

    List<RegistryImage> parse(String body, String url) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root != null && root.isArray()) {
                return objectMapper.convertValue(root, IMAGE_LIST);
            }
            if (root != null && root.isObject()) {
                List<RegistryImage> images = new ArrayList<>();
                root.fields()
                        .forEachRemaining(
                                entry ->
                                        images.add(
                                                new RegistryImage(
                                                        entry.getValue().asText(),
                                                        entry.getKey())));
                return images;
            }
            throw new RegistryException("Unexpected tag listing from " + url + ": " + body);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new RegistryException("Malformed tag listing from " + url, e);
        }
    }

    // Basic credentials are sent with the first request; the registry does not challenge.
    private void authenticate(HttpClientContext context, String url, String password) {
        HttpHost registry = HttpHost.create(URI.create(url));
        UsernamePasswordCredentials credentials =
                new UsernamePasswordCredentials(config.registry().user(), password.toCharArray());

        BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
        credentialsProvider.setCredentials(new AuthScope(registry), credentials);
        context.setCredentialsProvider(credentialsProvider);

        BasicScheme scheme = new BasicScheme();
        scheme.initPreemptive(credentials);
        BasicAuthCache authCache = new BasicAuthCache();
        authCache.put(registry, scheme);
        context.setAuthCache(authCache);
    }
}
