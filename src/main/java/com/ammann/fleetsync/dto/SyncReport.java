/* (C)2026 */
package com.ammann.fleetsync.dto;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one fleet sync pass.
 *
 * @param startedAt  when the pass began
 * @param finishedAt when the pass ended
 * @param outcomes   one entry per unit of work attempted, in execution order
 * @param abortCause why the pass stopped early, {@code null} if it ran to the end
 */
public record SyncReport(
        Instant startedAt, Instant finishedAt, List<UnitOutcome> outcomes, String abortCause) {

    public SyncReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean aborted() {
        return abortCause != null;
    }

    public long count(UnitOutcome.State state) {
        return outcomes.stream().filter(outcome -> outcome.state() == state).count();
    }

    public List<UnitOutcome> failures() {
        return outcomes.stream()
                .filter(outcome -> outcome.state() != UnitOutcome.State.SUCCEEDED)
                .toList();
    }
}
