/* (C)2026 */
package com.ammann.fleetsync.model;

/**
 * Common contract of every record held by the fleet store.
 *
 * <p>Sessions hand out working copies of stored entities and write them back on commit, so every
 * entity must be able to produce a detached deep copy of itself.
 *
 * @param <T> the concrete entity type
 */
public interface FleetEntity<T extends FleetEntity<T>> {

    /**
     * Returns the identity of this entity within its own type.
     *
     * @return the entity key, never {@code null}
     */
    String key();

    /**
     * Returns a detached copy that shares no mutable state with this instance.
     *
     * @return the copy
     */
    T copy();
}
