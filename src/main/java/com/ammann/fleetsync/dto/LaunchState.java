/* (C)2026 */
package com.ammann.fleetsync.dto;

/** Lifecycle of an asynchronous deployment launch. */
public enum LaunchState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
