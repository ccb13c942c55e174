/* (C)2026 */
package com.ammann.fleetsync.service;

import java.time.Duration;

/** Blocks the calling thread between retry attempts. */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    /** Returns a sleeper backed by {@link Thread#sleep(long)}. */
    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
