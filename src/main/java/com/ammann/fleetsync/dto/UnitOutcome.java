/* (C)2026 */
package com.ammann.fleetsync.dto;

/**
 * Result of one unit of work within a sync pass.
 *
 * @param kind  what was synchronized
 * @param key   the key of the synchronized entity
 * @param state how the unit ended
 * @param cause failure or degradation detail, {@code null} on success
 */
public record UnitOutcome(Kind kind, String key, State state, String cause) {

    /** The entity type a unit of work covers. */
    public enum Kind {
        APP,
        DEPLOYMENT,
        HOST
    }

    /** How a unit of work ended. */
    public enum State {
        /** Committed. */
        SUCCEEDED,
        /** Committed, but part of the refresh could not be performed. */
        DEGRADED,
        /** Rolled back. */
        FAILED
    }

    public static UnitOutcome succeeded(Kind kind, String key) {
        return new UnitOutcome(kind, key, State.SUCCEEDED, null);
    }

    public static UnitOutcome degraded(Kind kind, String key, String cause) {
        return new UnitOutcome(kind, key, State.DEGRADED, cause);
    }

    public static UnitOutcome failed(Kind kind, String key, Throwable cause) {
        return new UnitOutcome(kind, key, State.FAILED, describe(cause));
    }

    /** Returns a one-line description of a failure. */
    public static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null ? cause.getClass().getSimpleName() : message;
    }
}
