/* (C)2026 */
package com.ammann.fleetsync.persistence;

import com.ammann.fleetsync.config.FleetConfig;
import com.ammann.fleetsync.exception.FleetStoreException;
import com.ammann.fleetsync.model.App;
import com.ammann.fleetsync.model.Deployment;
import com.ammann.fleetsync.model.Host;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jboss.logging.Logger;

/**
 * Seeds the fleet store from the JSON inventory named by {@code fleet.inventory}.
 *
 * <p>Runs before any startup sync pass. Entities already present in the store are left as they
 * are.
 */
@ApplicationScoped
public class FleetInventoryLoader {

    @Inject FleetStore store;

    @Inject ObjectMapper objectMapper;

    @Inject FleetConfig config;

    @Inject Logger logger;

    void onStart(@Observes @Priority(1) StartupEvent event) {
        config.inventory()
                .filter(location -> !location.isBlank())
                .ifPresent(location -> load(Path.of(location)));
    }

    /**
     * Reads an inventory file and adds its entities to the store in one unit of work.
     *
     * @param location the inventory file
     * @return the parsed inventory
     * @throws FleetStoreException if the file cannot be read or references unknown entities
     */
    public FleetInventory load(Path location) {
        FleetInventory inventory;
        try {
            inventory = objectMapper.readValue(Files.readAllBytes(location), FleetInventory.class);
        } catch (IOException e) {
            throw new FleetStoreException("Could not read fleet inventory " + location, e);
        }

        try (FleetSession session = store.openSession()) {
            seed(session, inventory);
            session.commit();
        }
        logger.infof(
                "Loaded fleet inventory %s: %d apps, %d hosts, %d deployments",
                location,
                inventory.apps().size(),
                inventory.hosts().size(),
                inventory.deployments().size());
        return inventory;
    }

    void seed(FleetSession session, FleetInventory inventory) {
        for (String appName : inventory.apps()) {
            if (session.app(appName).isEmpty()) {
                session.add(new App(appName));
            }
        }
        for (FleetInventory.HostEntry entry : inventory.hosts()) {
            String key = Host.keyOf(entry.hostname(), entry.port());
            if (session.host(key).isEmpty()) {
                session.add(new Host(entry.hostname(), entry.port(), entry.alias()));
            }
        }
        for (FleetInventory.DeploymentEntry entry : inventory.deployments()) {
            String key = Deployment.keyOf(entry.app(), entry.tag(), entry.environment());
            if (session.deployment(key).isPresent()) {
                continue;
            }
            if (session.app(entry.app()).isEmpty()) {
                session.add(new App(entry.app()));
            }
            Deployment deployment = new Deployment(entry.app(), entry.tag(), entry.environment());
            deployment.setStatusPort(entry.statusPort());
            deployment.setStatusEndpoint(entry.statusEndpoint());
            for (String hostKey : entry.hosts()) {
                if (session.host(hostKey).isEmpty()) {
                    throw new FleetStoreException(
                            "Deployment " + key + " references unknown host " + hostKey);
                }
                deployment.addHost(hostKey);
            }
            deployment.setMappedPorts(entry.ports());
            deployment.setMappedVolumes(entry.volumes());
            deployment.setDependencies(entry.dependencies());
            session.add(deployment);
        }
    }
}
