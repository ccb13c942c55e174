/* (C)2026 */
package com.ammann.fleetsync.exception;

/** Raised by a fleet store that cannot open a session, load its inventory or persist a commit. */
public class FleetStoreException extends RuntimeException {

    public FleetStoreException(String message) {
        super(message);
    }

    public FleetStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
