/* (C)2026 */
package com.ammann.fleetsync.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A rollout target: one image tag of an app, in one environment, on an ordered set of hosts.
 *
 * <p>The linked containers are re-derived on every pass and replaced wholesale; they are never
 * treated as a source of truth.
 */
public class Deployment implements FleetEntity<Deployment> {

    private final String appName;
    private final String imageTag;
    private final String environment;
    private int statusPort;
    private String statusEndpoint;
    private final Set<String> hostKeys = new LinkedHashSet<>();
    private final List<String> mappedPorts = new ArrayList<>();
    private final List<String> mappedVolumes = new ArrayList<>();
    private final List<String> dependencies = new ArrayList<>();
    private final Set<String> containerIds = new LinkedHashSet<>();

    public Deployment(String appName, String imageTag, String environment) {
        this.appName = appName;
        this.imageTag = imageTag;
        this.environment = environment;
    }

    /**
     * Builds the store key of a deployment.
     *
     * @return {@code app:tag/environment}
     */
    public static String keyOf(String appName, String imageTag, String environment) {
        return appName + ":" + imageTag + "/" + environment;
    }

    public String getAppName() {
        return appName;
    }

    public String getImageTag() {
        return imageTag;
    }

    public String getEnvironment() {
        return environment;
    }

    public int getStatusPort() {
        return statusPort;
    }

    public void setStatusPort(int statusPort) {
        this.statusPort = statusPort;
    }

    public String getStatusEndpoint() {
        return statusEndpoint;
    }

    public void setStatusEndpoint(String statusEndpoint) {
        this.statusEndpoint = statusEndpoint;
    }

    public Set<String> getHostKeys() {
        return Collections.unmodifiableSet(hostKeys);
    }

    public void addHost(String hostKey) {
        hostKeys.add(hostKey);
    }

    public List<String> getMappedPorts() {
        return Collections.unmodifiableList(mappedPorts);
    }

    public void setMappedPorts(Collection<String> ports) {
        mappedPorts.clear();
        mappedPorts.addAll(ports);
    }

    public List<String> getMappedVolumes() {
        return Collections.unmodifiableList(mappedVolumes);
    }

    public void setMappedVolumes(Collection<String> volumes) {
        mappedVolumes.clear();
        mappedVolumes.addAll(volumes);
    }

    /** Keys of the deployments that must run before this one on every target host. */
    public List<String> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public void setDependencies(Collection<String> deploymentKeys) {
        dependencies.clear();
        dependencies.addAll(deploymentKeys);
    }

    public Set<String> getContainerIds() {
        return Collections.unmodifiableSet(containerIds);
    }

    public void replaceContainers(Collection<String> ids) {
        containerIds.clear();
        containerIds.addAll(ids);
    }

    /** Container name used when launching this deployment on a host. */
    public String containerName() {
        return appName + "-" + environment;
    }

    @Override
    public String key() {
        return keyOf(appName, imageTag, environment);
    }

    @Override
    public Deployment copy() {
        Deployment copy = new Deployment(appName, imageTag, environment);
        copy.statusPort = statusPort;
        copy.statusEndpoint = statusEndpoint;
        copy.hostKeys.addAll(hostKeys);
        copy.mappedPorts.addAll(mappedPorts);
        copy.mappedVolumes.addAll(mappedVolumes);
        copy.dependencies.addAll(dependencies);
        copy.containerIds.addAll(containerIds);
        return copy;
    }

    @Override
    public String toString() {
        return "Deployment[" + key() + "]";
    }
}
