/* (C)2026 */
package com.ammann.fleetsync.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

import com.ammann.fleetsync.dto.LaunchStatus;
import com.ammann.fleetsync.dto.SyncReport;
import com.ammann.fleetsync.exception.FleetEntityNotFoundException;
import com.ammann.fleetsync.service.DeploymentLauncher;
import com.ammann.fleetsync.service.FleetSyncOrchestrator;
import com.ammann.fleetsync.service.HostContainerService;
import com.ammann.fleetsync.service.LaunchTracker;
import jakarta.ws.rs.core.Response;
import java.lang.reflect.Field;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FleetResource")
class FleetResourceTest {

    FleetResource resource;
    FleetSyncOrchestrator orchestrator;
    DeploymentLauncher launcher;
    LaunchTracker launchTracker;
    HostContainerService containerService;

    @BeforeEach
    void setUp() throws Exception {
        resource = new FleetResource();
        orchestrator = mock(FleetSyncOrchestrator.class);
        launcher = mock(DeploymentLauncher.class);
        launchTracker = mock(LaunchTracker.class);
        containerService = mock(HostContainerService.class);

        injectField(resource, "orchestrator", orchestrator);
        injectField(resource, "launcher", launcher);
        injectField(resource, "launchTracker", launchTracker);
        injectField(resource, "containerService", containerService);
        injectField(resource, "logger", mock(Logger.class));
    }

    private void injectField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    @Nested
    @DisplayName("sync")
    class Sync {

        @Test
        @DisplayName("should run a pass and return its report")
        void shouldRunPass() {
            SyncReport report = new SyncReport(Instant.now(), Instant.now(), List.of(), null);
            when(orchestrator.runPass()).thenReturn(report);

            assertThat(resource.sync()).isSameAs(report);
        }
    }

    @Nested
    @DisplayName("launches")
    class Launches {

        @Test
        @DisplayName("should accept a launch of the deployment addressed by the path")
        void shouldAcceptLaunch() {
            LaunchStatus status = LaunchStatus.pending("l1", "billing:v1/prod", Instant.now());
            when(launcher.launch("billing:v1/prod")).thenReturn(status);

            Response response = resource.launch("billing", "v1", "prod");

            assertThat(response.getStatus()).isEqualTo(202);
            assertThat(response.getEntity()).isSameAs(status);
        }

        @Test
        @DisplayName("should propagate unknown deployments")
        void shouldPropagateUnknownDeployment() {
            when(launcher.launch("ghost:1/prod"))
                    .thenThrow(new FleetEntityNotFoundException("Deployment", "ghost:1/prod"));

            assertThatThrownBy(() -> resource.launch("ghost", "1", "prod"))
                    .isInstanceOf(FleetEntityNotFoundException.class);
        }

        @Test
        @DisplayName("should return the status of a tracked launch")
        void shouldReturnLaunchStatus() {
            LaunchStatus status = LaunchStatus.pending("l1", "billing:v1/prod", Instant.now());
            when(launchTracker.find("l1")).thenReturn(Optional.of(status));

            assertThat(resource.launchStatus("l1")).isSameAs(status);
        }

        @Test
        @DisplayName("should throw not found for unknown launches")
        void shouldThrowForUnknownLaunch() {
            when(launchTracker.find("nope")).thenReturn(Optional.empty());

            assertThatThrownBy(() -> resource.launchStatus("nope"))
                    .isInstanceOf(FleetEntityNotFoundException.class)
                    .hasMessage("Launch not found: nope");
        }
    }

    @Nested
    @DisplayName("containers")
    class Containers {

        @Test
        @DisplayName("should return container logs")
        void shouldReturnLogs() {
            when(containerService.getContainerLogs("h1", 2375, "c1", 100)).thenReturn("log");

            assertThat(resource.getContainerLogs("h1", 2375, "c1", 100)).isEqualTo("log");
        }

        @Test
        @DisplayName("should stop container and return 204")
        void shouldStopContainer() {
            Response response = resource.stopContainer("h1", 2375, "c1");

            assertThat(response.getStatus()).isEqualTo(204);
            verify(containerService).stopContainer("h1", 2375, "c1");
        }

        @Test
        @DisplayName("should remove container and return 204")
        void shouldRemoveContainer() {
            Response response = resource.removeContainer("h1", 2375, "c1");

            assertThat(response.getStatus()).isEqualTo(204);
            verify(containerService).removeContainer("h1", 2375, "c1");
        }
    }
}
