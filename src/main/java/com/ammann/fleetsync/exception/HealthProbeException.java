/* (C)2026 */
package com.ammann.fleetsync.exception;

/**
 * Raised when every attempt to reach a status endpoint failed before a response was received.
 * The cause is the failure of the last attempt.
 */
public class HealthProbeException extends RuntimeException {

    private final String url;
    private final int attempts;

    public HealthProbeException(String url, int attempts, Throwable cause) {
        super("Status check of " + url + " failed after " + attempts + " attempt(s)", cause);
        this.url = url;
        this.attempts = attempts;
    }

    public String getUrl() {
        return url;
    }

    public int getAttempts() {
        return attempts;
    }
}
