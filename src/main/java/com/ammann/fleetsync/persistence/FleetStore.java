/* (C)2026 */
package com.ammann.fleetsync.persistence;

/**
 * Persistence gateway over the fleet entity graph.
 *
 * <p>Every unit of work (an app sync, a deployment sync, a host sync, a launch) opens its own
 * {@link FleetSession} and commits or rolls back independently. There is no cross-session
 * locking; concurrent commits to the same row are last-writer-wins.
 */
public interface FleetStore {

    /**
     * Opens a new unit of work.
     *
     * @return a session that must be closed by the caller
     * @throws com.ammann.fleetsync.exception.FleetStoreException if no session can be opened
     */
    FleetSession openSession();
}
