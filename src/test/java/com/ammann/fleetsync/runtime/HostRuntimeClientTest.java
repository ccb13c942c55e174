/* (C)2026 */
package com.ammann.fleetsync.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.ammann.fleetsync.config.DockerClientFactory;
import com.ammann.fleetsync.config.FleetConfigFixture;
import com.ammann.fleetsync.model.Host;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.LogContainerCmd;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import java.lang.reflect.Field;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

@DisplayName("HostRuntimeClient")
class HostRuntimeClientTest {

    HostRuntimeClient client;
    DockerClientFactory clientFactory;
    DockerClient docker;
    Host host;

    @BeforeEach
    void setUp() throws Exception {
        client = new HostRuntimeClient();
        clientFactory = mock(DockerClientFactory.class);
        docker = mock(DockerClient.class, RETURNS_DEEP_STUBS);
        host = new Host("h1", 2375, "node-1");

        when(clientFactory.clientFor(any(Host.class))).thenReturn(docker);

        injectField(client, "clientFactory", clientFactory);
        injectField(client, "config", FleetConfigFixture.defaults());
        injectField(client, "logger", mock(Logger.class));
    }

    private void injectField(Object target, String fieldName, Object value) throws Exception {
        Field field = target.getClass().getDeclaredField(fieldName);
        field.setAccessible(true);
        field.set(target, value);
    }

    private static Container listed(String id, String state) {
        Container container = mock(Container.class);
        when(container.getId()).thenReturn(id);
        when(container.getState()).thenReturn(state);
        when(container.getImageId()).thenReturn("sha256:3f2a9c1b77e0d4aa");
        when(container.getImage()).thenReturn("fleet/billing:v1");
        when(container.getCommand()).thenReturn("java -jar app.jar");
        return container;
    }

    @Nested
    @DisplayName("snapshot")
    class Snapshot {

        @Test
        @DisplayName("should describe every container including stopped ones")
        void shouldDescribeEveryContainer() {
            Container running = listed("c1", "running");
            when(docker.listContainersCmd().withShowAll(true).exec()).thenReturn(List.of(running));

            InspectContainerResponse inspect =
                    mock(InspectContainerResponse.class, RETURNS_DEEP_STUBS);
            when(inspect.getState().getStatus()).thenReturn("running");
            when(inspect.getState().getStartedAt()).thenReturn("2024-01-15T10:30:00Z");
            when(inspect.getState().getFinishedAt()).thenReturn("0001-01-01T00:00:00Z");
            when(docker.inspectContainerCmd("c1").exec()).thenReturn(inspect);

            List<ContainerDescriptor> snapshot = client.snapshot(host);

            assertThat(snapshot)
                    .containsExactly(
                            new ContainerDescriptor(
                                    "c1",
                                    "running",
                                    "3f2a9c1b77e0d4aa",
                                    "fleet/billing:v1",
                                    "2024-01-15T10:30:00Z",
                                    "0001-01-01T00:00:00Z",
                                    "java -jar app.jar"));
        }

        @Test
        @DisplayName("should skip containers removed between listing and inspection")
        void shouldSkipVanishedContainers() {
            Container gone = listed("gone", "exited");
            Container kept = listed("kept", "exited");
            when(docker.listContainersCmd().withShowAll(true).exec())
                    .thenReturn(List.of(gone, kept));
            when(docker.inspectContainerCmd("gone").exec())
                    .thenThrow(new NotFoundException("No such container"));
            when(docker.inspectContainerCmd("kept").exec())
                    .thenReturn(mock(InspectContainerResponse.class));

            List<ContainerDescriptor> snapshot = client.snapshot(host);

            assertThat(snapshot).extracting(ContainerDescriptor::id).containsExactly("kept");
            assertThat(snapshot.get(0).state()).isEqualTo("exited");
        }

        @Test
        @DisplayName("should propagate daemon failures")
        void shouldPropagateDaemonFailures() {
            when(docker.listContainersCmd().withShowAll(true).exec())
                    .thenThrow(new RuntimeException("Connection refused"));

            assertThatThrownBy(() -> client.snapshot(host)).hasMessage("Connection refused");
        }
    }

    @Nested
    @DisplayName("createAndStart")
    class CreateAndStart {

        CreateContainerCmd createCmd;
        PullImageCmd pullCmd;
        PullImageResultCallback pullCallback;

        @BeforeEach
        void setUp() throws Exception {
            pullCmd = mock(PullImageCmd.class, RETURNS_SELF);
            pullCallback = mock(PullImageResultCallback.class);
            when(pullCmd.exec(any())).thenReturn(pullCallback);
            when(pullCallback.awaitCompletion(anyLong(), any(TimeUnit.class))).thenReturn(true);
            when(docker.pullImageCmd("fleet/billing:v1")).thenReturn(pullCmd);

            createCmd = mock(CreateContainerCmd.class, RETURNS_SELF);
            CreateContainerResponse response = mock(CreateContainerResponse.class);
            when(response.getId()).thenReturn("new-id");
            when(createCmd.exec()).thenReturn(response);
            when(docker.createContainerCmd("fleet/billing:v1")).thenReturn(createCmd);
        }

        @Test
        @DisplayName("should pull, create with bindings and start the container")
        void shouldPullCreateAndStart() {
            String id =
                    client.createAndStart(
                            host,
                            "fleet/billing:v1",
                            "billing-prod",
                            List.of("8080:8080"),
                            List.of("/srv/data:/data"),
                            Map.of("fleet.deployment", "billing:v1/prod"));

            assertThat(id).isEqualTo("new-id");
            InOrder order = inOrder(pullCmd, createCmd, docker);
            order.verify(pullCmd).exec(any());
            order.verify(createCmd).exec();
            order.verify(docker).startContainerCmd("new-id");

            verify(createCmd).withName("billing-prod");
            verify(createCmd).withLabels(Map.of("fleet.deployment", "billing:v1/prod"));
            verify(createCmd).withExposedPorts(new ExposedPort[] {ExposedPort.tcp(8080)});

            ArgumentCaptor<HostConfig> hostConfig = ArgumentCaptor.forClass(HostConfig.class);
            verify(createCmd).withHostConfig(hostConfig.capture());
            assertThat(hostConfig.getValue().getPortBindings().getBindings())
                    .containsKey(ExposedPort.tcp(8080));
            assertThat(hostConfig.getValue().getBinds()).hasSize(1);
            assertThat(hostConfig.getValue().getBinds()[0].getPath()).isEqualTo("/srv/data");
        }

        @Test
        @DisplayName("should pull with the registry credentials")
        void shouldPullWithCredentials() {
            client.createAndStart(
                    host, "fleet/billing:v1", "billing-prod", List.of(), List.of(), Map.of());

            verify(pullCmd)
                    .withAuthConfig(
                            argThat(
                                    auth ->
                                            "fleet".equals(auth.getUsername())
                                                    && "http://registry.local:5000"
                                                            .equals(auth.getRegistryAddress())));
        }

        @Test
        @DisplayName("should fail without creating when the pull does not finish in time")
        void shouldFailOnPullTimeout() throws Exception {
            when(pullCallback.awaitCompletion(anyLong(), any(TimeUnit.class))).thenReturn(false);

            assertThatThrownBy(
                            () ->
                                    client.createAndStart(
                                            host,
                                            "fleet/billing:v1",
                                            "billing-prod",
                                            List.of(),
                                            List.of(),
                                            Map.of()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("did not finish");
            verify(createCmd, never()).exec();
        }
    }

    @Nested
    @DisplayName("deployWithDependencies")
    class DeployWithDependencies {

        @Test
        @DisplayName("should start dependencies first and label only the top container")
        void shouldStartDependenciesFirst() {
            HostRuntimeClient spyClient = spy(client);
            doReturn("pg-id", "app-id")
                    .when(spyClient)
                    .createAndStart(any(), anyString(), anyString(), anyList(), anyList(), anyMap());

            DeploymentManifest postgres =
                    new DeploymentManifest(
                            "postgres:15/prod",
                            "fleet/postgres:15",
                            "postgres-prod",
                            List.of(),
                            List.of("/srv/pg:/data"),
                            List.of());
            DeploymentManifest billing =
                    new DeploymentManifest(
                            "billing:v1/prod",
                            "fleet/billing:v1",
                            "billing-prod",
                            List.of("8080:8080"),
                            List.of(),
                            List.of(postgres));

            List<String> started = spyClient.deployWithDependencies(host, billing, "{}");

            assertThat(started).containsExactly("pg-id", "app-id");
            InOrder order = inOrder(spyClient);
            order.verify(spyClient)
                    .createAndStart(
                            host,
                            "fleet/postgres:15",
                            "postgres-prod",
                            List.of(),
                            List.of("/srv/pg:/data"),
                            Map.of(HostRuntimeClient.DEPLOYMENT_LABEL, "postgres:15/prod"));
            order.verify(spyClient)
                    .createAndStart(
                            host,
                            "fleet/billing:v1",
                            "billing-prod",
                            List.of("8080:8080"),
                            List.of(),
                            Map.of(
                                    HostRuntimeClient.DEPLOYMENT_LABEL,
                                    "billing:v1/prod",
                                    HostRuntimeClient.MANIFEST_LABEL,
                                    "{}"));
        }
    }

    @Nested
    @DisplayName("container actions")
    class ContainerActions {

        @Test
        @DisplayName("should stop with a ten second grace period")
        void shouldStopContainer() {
            client.stop(host, "c1");

            verify(docker.stopContainerCmd("c1")).withTimeout(10);
        }

        @Test
        @DisplayName("should tolerate stopping an already stopped container")
        void shouldTolerateAlreadyStopped() {
            when(docker.stopContainerCmd("c1").withTimeout(10).exec())
                    .thenThrow(new NotModifiedException("Container already stopped"));

            client.stop(host, "c1");
        }

        @Test
        @DisplayName("should remove the container")
        void shouldRemoveContainer() {
            client.remove(host, "c1");

            verify(docker).removeContainerCmd("c1");
        }

        @Test
        @DisplayName("should collect stdout and stderr frames")
        @SuppressWarnings("unchecked")
        void shouldCollectLogs() {
            LogContainerCmd logCmd = mock(LogContainerCmd.class, RETURNS_SELF);
            when(docker.logContainerCmd("c1")).thenReturn(logCmd);
            when(logCmd.exec(any()))
                    .thenAnswer(
                            invocation -> {
                                ResultCallback.Adapter<Frame> callback = invocation.getArgument(0);
                                callback.onNext(
                                        new Frame(
                                                StreamType.STDOUT,
                                                "started\n".getBytes(StandardCharsets.UTF_8)));
                                callback.onNext(
                                        new Frame(
                                                StreamType.STDERR,
                                                "warning\n".getBytes(StandardCharsets.UTF_8)));
                                callback.onComplete();
                                return callback;
                            });

            assertThat(client.logs(host, "c1", 50)).isEqualTo("started\nwarning\n");
            verify(logCmd).withTail(50);
            verify(logCmd).withStdOut(true);
            verify(logCmd).withStdErr(true);
        }

        @Test
        @DisplayName("should fail instead of returning partial logs when the stream times out")
        @SuppressWarnings("unchecked")
        void shouldFailOnLogTimeout() throws Exception {
            LogContainerCmd logCmd = mock(LogContainerCmd.class, RETURNS_SELF);
            ResultCallback.Adapter<Frame> pending = mock(ResultCallback.Adapter.class);
            when(docker.logContainerCmd("c1")).thenReturn(logCmd);
            when(logCmd.exec(any())).thenReturn(pending);
            when(pending.awaitCompletion(anyLong(), any(TimeUnit.class))).thenReturn(false);

            assertThatThrownBy(() -> client.logs(host, "c1", 50))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("Logs of c1 did not finish");
        }
    }

    @Test
    @DisplayName("should strip the digest algorithm from image ids")
    void shouldStripAlgorithm() {
        assertThat(HostRuntimeClient.stripAlgorithm("sha256:3f2a9c1b")).isEqualTo("3f2a9c1b");
        assertThat(HostRuntimeClient.stripAlgorithm("3f2a9c1b")).isEqualTo("3f2a9c1b");
        assertThat(HostRuntimeClient.stripAlgorithm(null)).isNull();
    }
}
