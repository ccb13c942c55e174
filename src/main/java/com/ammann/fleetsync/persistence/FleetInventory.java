/* (C)2026 */
package com.ammann.fleetsync.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * JSON document describing the fleet's apps, hosts and deployments.
 *
 * <p>Deployments reference hosts as {@code hostname:port} and dependencies as deployment keys.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FleetInventory(
        List<String> apps, List<HostEntry> hosts, List<DeploymentEntry> deployments) {

    public FleetInventory {
        apps = apps == null ? List.of() : apps;
        hosts = hosts == null ? List.of() : hosts;
        deployments = deployments == null ? List.of() : deployments;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HostEntry(String hostname, int port, String alias) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DeploymentEntry(
            String app,
            String tag,
            String environment,
            int statusPort,
            String statusEndpoint,
            List<String> hosts,
            List<String> ports,
            List<String> volumes,
            List<String> dependencies) {

        public DeploymentEntry {
            hosts = hosts == null ? List.of() : hosts;
            ports = ports == null ? List.of() : ports;
            volumes = volumes == null ? List.of() : volumes;
            dependencies = dependencies == null ? List.of() : dependencies;
        }
    }
}
