/* (C)2026 */
package com.ammann.fleetsync.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Fleet entities")
class FleetEntityTest {

    @Nested
    @DisplayName("App")
    class AppEntity {

        @Test
        @DisplayName("should record each image once")
        void shouldRecordEachImageOnce() {
            App app = new App("billing");

            assertThat(app.addImage("3f2a9c1b")).isTrue();
            assertThat(app.addImage("3f2a9c1b")).isFalse();
            assertThat(app.getImageIds()).containsExactly("3f2a9c1b");
        }

        @Test
        @DisplayName("should expose images read-only")
        void shouldExposeImagesReadOnly() {
            App app = new App("billing");

            assertThatThrownBy(() -> app.getImageIds().add("x"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }
    }

    @Nested
    @DisplayName("Host")
    class HostEntity {

        @Test
        @DisplayName("should be keyed by hostname and port")
        void shouldBeKeyedByHostnameAndPort() {
            Host host = new Host("h1", 2375, null);

            assertThat(host.key()).isEqualTo("h1:2375");
            assertThat(host.getStatus()).isEqualTo(HostStatus.UNKNOWN);
            assertThat(host.displayName()).isEqualTo("h1:2375");
        }

        @Test
        @DisplayName("should prefer the alias for display")
        void shouldPreferAlias() {
            assertThat(new Host("h1", 2375, "node-1").displayName()).isEqualTo("node-1");
        }
    }

    @Nested
    @DisplayName("Container")
    class ContainerEntity {

        @ParameterizedTest
        @ValueSource(strings = {"running", "Running", "RUNNING"})
        @DisplayName("should treat running in any case as running")
        void shouldDetectRunningState(String state) {
            Container container = new Container("c1", "h1:2375");
            container.setState(state);

            assertThat(container.isRunning()).isTrue();
        }

        @Test
        @DisplayName("should default to down and not running")
        void shouldDefaultToDown() {
            Container container = new Container("c1", "h1:2375");

            assertThat(container.isRunning()).isFalse();
            assertThat(container.getStatus()).isEqualTo(ContainerStatus.DOWN);
        }

        @Test
        @DisplayName("should copy every field")
        void shouldCopyEveryField() {
            Container container = new Container("c1", "h1:2375");
            container.setState("running");
            container.setImageRef("fleet/billing:v1");
            container.setImageId("3f2a9c1b");
            container.setStatus(ContainerStatus.UP);
            container.setStartedAt(LocalDateTime.of(2024, 1, 15, 10, 30));
            container.setCommand("java -jar app.jar");

            Container copy = container.copy();

            assertThat(copy).isNotSameAs(container).usingRecursiveComparison().isEqualTo(container);
        }
    }

    @Nested
    @DisplayName("Deployment")
    class DeploymentEntity {

        @Test
        @DisplayName("should derive key and container name")
        void shouldDeriveKeyAndContainerName() {
            Deployment deployment = new Deployment("billing", "v1", "prod");

            assertThat(deployment.key()).isEqualTo("billing:v1/prod");
            assertThat(deployment.containerName()).isEqualTo("billing-prod");
        }

        @Test
        @DisplayName("should copy collections independently")
        void shouldCopyCollectionsIndependently() {
            Deployment deployment = new Deployment("billing", "v1", "prod");
            deployment.addHost("h1:2375");
            deployment.replaceContainers(List.of("c1"));

            Deployment copy = deployment.copy();
            copy.addHost("h2:2375");
            copy.replaceContainers(List.of());

            assertThat(deployment.getHostKeys()).containsExactly("h1:2375");
            assertThat(deployment.getContainerIds()).containsExactly("c1");
        }
    }

    @Nested
    @DisplayName("Image")
    class ImageEntity {

        @Test
        @DisplayName("should link and unlink containers")
        void shouldLinkAndUnlinkContainers() {
            Image image = new Image("3f2a9c1b", "billing", "v1");
            image.linkContainer("c1");
            image.linkContainer("c1");
            image.linkContainer("c2");
            image.unlinkContainer("c1");

            assertThat(image.getContainerIds()).containsExactly("c2");
            assertThat(image.copy().getContainerIds()).containsExactly("c2");
        }
    }
}
