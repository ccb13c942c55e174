/* (C)2026 */
package com.ammann.fleetsync.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Configuration mapping for the fleet sync worker, sourced from the {@code fleet.*} properties.
 *
 * <p>Only one registry is supported and it is fixed at startup. Host coordinates are not
 * configured here; they come from the persisted inventory.
 */
@ConfigMapping(prefix = "fleet")
public interface FleetConfig {

    Registry registry();

    Docker docker();

    Probe probe();

    Launch launch();

    Sync sync();

    /**
     * Zone used to turn runtime timestamps into local wall-clock values. Defaults to the system
     * zone when absent.
     */
    Optional<ZoneId> timezone();

    /** Path of the JSON inventory loaded into the store at startup. */
    Optional<String> inventory();

    /** Private registry coordinates and credentials. */
    interface Registry {

        @WithDefault("http://localhost:5000")
        String url();

        /** Registry namespace; also the first segment of every image reference. */
        @WithDefault("fleet")
        String user();

        Optional<String> password();

        @WithName("timeout")
        @WithDefault("15s")
        Duration timeout();
    }

    /** Docker daemon transport settings shared by all hosts. */
    interface Docker {

        @WithName("tls-verify")
        @WithDefault("false")
        boolean tlsVerify();

        /** Directory holding {@code ca.pem}, {@code cert.pem} and {@code key.pem}. */
        @WithName("cert-path")
        Optional<String> certPath();

        @WithName("connect-timeout")
        @WithDefault("10s")
        Duration connectTimeout();

        @WithName("response-timeout")
        @WithDefault("45s")
        Duration responseTimeout();

        @WithName("pull-timeout")
        @WithDefault("5m")
        Duration pullTimeout();
    }

    /** Health probe retry policy. */
    interface Probe {

        @WithDefault("3")
        int attempts();

        @WithDefault("10s")
        Duration timeout();

        @WithDefault("5s")
        Duration pause();
    }

    /** Deployment launch worker pool. */
    interface Launch {

        @WithDefault("4")
        int workers();
    }

    /** Periodic sync pass trigger. */
    interface Sync {

        /** Period between scheduled passes; overlapping passes are skipped. */
        @WithDefault("60s")
        String interval();

        @WithName("initial-delay")
        @WithDefault("10s")
        String initialDelay();

        /** Whether to run one pass as soon as the application has started. */
        @WithName("on-start")
        @WithDefault("false")
        boolean onStart();
    }
}
