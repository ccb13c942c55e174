/* (C)2026 */
package com.ammann.fleetsync.properties;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Centralised path constants for the REST API.
 *
 * <p>All resource classes reference these constants to ensure consistent URL construction.
 */
@RegisterForReflection
public final class ApiProperties {

    private ApiProperties() {}

    /** Base path for API version 1 endpoints. */
    public static final String BASE_URL_V1 = "/api/v1";

    /** Path constants for fleet endpoints. */
    public static final class Fleet {
        private Fleet() {}

        public static final String SYNC = "/fleet/sync";

        public static final String LAUNCH = "/deployments/{app}/{tag}/{environment}/launch";

        public static final String LAUNCH_STATUS = "/launches/{id}";

        public static final String HOST_CONTAINER = "/hosts/{hostname}/{port}/containers/{id}";
    }
}
