/* (C)2026 */
package com.ammann.fleetsync.exception;

/**
 * Runtime exception thrown when an operation names a deployment, host, container or launch that
 * is not known.
 *
 * <p>Mapped to an HTTP 404 Not Found response by {@link FleetEntityNotFoundExceptionMapper}.
 */
public class FleetEntityNotFoundException extends RuntimeException {

    private final String entity;

    /**
     * Constructs a new exception for the given entity.
     *
     * @param kind the kind of entity, e.g. "Deployment"
     * @param key  the key that was looked up
     */
    public FleetEntityNotFoundException(String kind, String key) {
        super(kind + " not found: " + key);
        this.entity = key;
    }

    /**
     * Returns the key that could not be resolved.
     *
     * @return the entity key
     */
    public String getEntity() {
        return entity;
    }
}
