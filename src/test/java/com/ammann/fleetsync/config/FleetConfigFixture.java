/* (C)2026 */
package com.ammann.fleetsync.config;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Optional;

/** Builds {@link FleetConfig} mocks carrying the documented defaults. */
public final class FleetConfigFixture {

    private FleetConfigFixture() {}

    public static FleetConfig defaults() {
        return withProbe(3, Duration.ofSeconds(10), Duration.ofSeconds(5));
    }

    public static FleetConfig withProbe(int attempts, Duration timeout, Duration pause) {
        FleetConfig config = mock(FleetConfig.class);

        FleetConfig.Registry registry = mock(FleetConfig.Registry.class);
        when(registry.url()).thenReturn("http://registry.local:5000");
        when(registry.user()).thenReturn("fleet");
        when(registry.password()).thenReturn(Optional.empty());
        when(registry.timeout()).thenReturn(Duration.ofSeconds(15));
        when(config.registry()).thenReturn(registry);

        FleetConfig.Docker docker = mock(FleetConfig.Docker.class);
        when(docker.tlsVerify()).thenReturn(false);
        when(docker.certPath()).thenReturn(Optional.empty());
        when(docker.connectTimeout()).thenReturn(Duration.ofSeconds(10));
        when(docker.responseTimeout()).thenReturn(Duration.ofSeconds(45));
        when(docker.pullTimeout()).thenReturn(Duration.ofMinutes(5));
        when(config.docker()).thenReturn(docker);

        FleetConfig.Probe probe = mock(FleetConfig.Probe.class);
        when(probe.attempts()).thenReturn(attempts);
        when(probe.timeout()).thenReturn(timeout);
        when(probe.pause()).thenReturn(pause);
        when(config.probe()).thenReturn(probe);

        FleetConfig.Launch launch = mock(FleetConfig.Launch.class);
        when(launch.workers()).thenReturn(4);
        when(config.launch()).thenReturn(launch);

        FleetConfig.Sync sync = mock(FleetConfig.Sync.class);
        when(sync.interval()).thenReturn("60s");
        when(sync.initialDelay()).thenReturn("10s");
        when(sync.onStart()).thenReturn(false);
        when(config.sync()).thenReturn(sync);

        when(config.timezone()).thenReturn(Optional.of(ZoneId.of("UTC")));
        when(config.inventory()).thenReturn(Optional.empty());
        return config;
    }
}
