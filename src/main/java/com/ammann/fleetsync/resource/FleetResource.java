/* (C)2026 */
package com.ammann.fleetsync.resource;

import com.ammann.fleetsync.dto.LaunchStatus;
import com.ammann.fleetsync.dto.SyncReport;
import com.ammann.fleetsync.exception.FleetEntityNotFoundException;
import com.ammann.fleetsync.model.Deployment;
import com.ammann.fleetsync.properties.ApiProperties;
import com.ammann.fleetsync.service.DeploymentLauncher;
import com.ammann.fleetsync.service.FleetSyncOrchestrator;
import com.ammann.fleetsync.service.HostContainerService;
import com.ammann.fleetsync.service.LaunchTracker;
import jakarta.inject.Inject;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.RestPath;
import org.jboss.resteasy.reactive.RestQuery;

/**
 * REST resource for triggering fleet syncs and launches and for acting on single containers.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Fleet Sync", description = "Fleet reconciliation, deployment launches and containers")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class FleetResource {

    private static final String PORT_DESCRIPTION = "Docker daemon port of the host";

    @Inject Logger logger;

    @Inject FleetSyncOrchestrator orchestrator;

    @Inject DeploymentLauncher launcher;

    @Inject LaunchTracker launchTracker;

    @Inject HostContainerService containerService;

    @POST
    @Path(ApiProperties.Fleet.SYNC)
    @Operation(summary = "Run sync pass", description = "Runs one fleet sync pass synchronously")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Report of the pass",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema = @Schema(implementation = SyncReport.class)))
    })
    public SyncReport sync() {
        logger.info("Fleet sync pass requested");
        return orchestrator.runPass();
    }

    @POST
    @Path(ApiProperties.Fleet.LAUNCH)
    @Operation(
            summary = "Launch deployment",
            description = "Starts the deployment on each of its hosts in the background")
    @APIResponses({
        @APIResponse(
                responseCode = "202",
                description = "Launch submitted",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema = @Schema(implementation = LaunchStatus.class))),
        @APIResponse(responseCode = "404", description = "Deployment not found")
    })
    public Response launch(
            @RestPath("app") @NotBlank String app,
            @RestPath("tag") @NotBlank String tag,
            @RestPath("environment") @NotBlank String environment) {

        String deploymentKey = Deployment.keyOf(app, tag, environment);
        logger.infof("Launch of deployment %s requested", deploymentKey);
        LaunchStatus status = launcher.launch(deploymentKey);
        return Response.accepted(status).build();
    }

    @GET
    @Path(ApiProperties.Fleet.LAUNCH_STATUS)
    @Operation(summary = "Get launch status", description = "Returns the state of a launch")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Launch status",
                content =
                        @Content(
                                mediaType = MediaType.APPLICATION_JSON,
                                schema = @Schema(implementation = LaunchStatus.class))),
        @APIResponse(responseCode = "404", description = "Launch not found or evicted")
    })
    public LaunchStatus launchStatus(@RestPath("id") @NotBlank String launchId) {
        return launchTracker
                .find(launchId)
                .orElseThrow(() -> new FleetEntityNotFoundException("Launch", launchId));
    }

    @GET
    @Path(ApiProperties.Fleet.HOST_CONTAINER + "/logs")
    @Produces(MediaType.TEXT_PLAIN)
    @Operation(
            summary = "Get container logs",
            description = "Returns the last N lines of container logs")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Container logs",
                content = @Content(mediaType = MediaType.TEXT_PLAIN)),
        @APIResponse(responseCode = "400", description = "Invalid tail parameter"),
        @APIResponse(responseCode = "404", description = "Host or container not found"),
        @APIResponse(responseCode = "500", description = "Docker daemon error")
    })
    public String getContainerLogs(
            @RestPath("hostname") @NotBlank String hostname,
            @Parameter(description = PORT_DESCRIPTION) @RestPath("port") int port,
            @RestPath("id") @NotBlank String containerId,
            @Parameter(description = "Number of log lines to return (1-10000)")
                    @RestQuery("tail")
                    @DefaultValue("100")
                    @Min(value = 1, message = "Tail must be at least 1")
                    @Max(value = 10000, message = "Tail must not exceed 10000")
                    int tail) {

        logger.debugf("Fetching logs for container %s (tail=%d)", containerId, tail);
        return containerService.getContainerLogs(hostname, port, containerId, tail);
    }

    @POST
    @Path(ApiProperties.Fleet.HOST_CONTAINER + "/stop")
    @Operation(summary = "Stop container", description = "Stops a running container")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Container stopped"),
        @APIResponse(responseCode = "404", description = "Host or container not found"),
        @APIResponse(responseCode = "500", description = "Docker daemon error")
    })
    public Response stopContainer(
            @RestPath("hostname") @NotBlank String hostname,
            @Parameter(description = PORT_DESCRIPTION) @RestPath("port") int port,
            @RestPath("id") @NotBlank String containerId) {

        logger.infof("Stopping container: %s", containerId);
        containerService.stopContainer(hostname, port, containerId);
        return Response.noContent().build();
    }

    @DELETE
    @Path(ApiProperties.Fleet.HOST_CONTAINER)
    @Operation(summary = "Remove container", description = "Removes a stopped container")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Container removed"),
        @APIResponse(responseCode = "404", description = "Host or container not found"),
        @APIResponse(responseCode = "500", description = "Docker daemon error")
    })
    public Response removeContainer(
            @RestPath("hostname") @NotBlank String hostname,
            @Parameter(description = PORT_DESCRIPTION) @RestPath("port") int port,
            @RestPath("id") @NotBlank String containerId) {

        logger.infof("Removing container: %s", containerId);
        containerService.removeContainer(hostname, port, containerId);
        return Response.noContent().build();
    }
}
