/* (C)2026 */
package com.ammann.fleetsync.dto;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Pollable state of a deployment launch. Instances are immutable; each transition returns a new
 * one.
 *
 * @param id          the launch id
 * @param deployment  the deployment key
 * @param state       the current lifecycle state
 * @param submittedAt when the launch was requested
 * @param finishedAt  when the launch reached a terminal state, {@code null} before that
 * @param hosts       per-host outcomes recorded so far
 * @param failure     why the launch failed, {@code null} otherwise
 */
public record LaunchStatus(
        String id,
        String deployment,
        LaunchState state,
        Instant submittedAt,
        Instant finishedAt,
        List<HostLaunchOutcome> hosts,
        String failure) {

    public LaunchStatus {
        hosts = List.copyOf(hosts);
    }

    public static LaunchStatus pending(String id, String deployment, Instant submittedAt) {
        return new LaunchStatus(
                id, deployment, LaunchState.PENDING, submittedAt, null, List.of(), null);
    }

    public LaunchStatus running() {
        return new LaunchStatus(
                id, deployment, LaunchState.RUNNING, submittedAt, null, hosts, null);
    }

    public LaunchStatus withHost(HostLaunchOutcome outcome) {
        List<HostLaunchOutcome> updated = new ArrayList<>(hosts);
        updated.add(outcome);
        return new LaunchStatus(id, deployment, state, submittedAt, finishedAt, updated, failure);
    }

    public LaunchStatus succeeded(Instant at) {
        return new LaunchStatus(
                id, deployment, LaunchState.SUCCEEDED, submittedAt, at, hosts, null);
    }

    public LaunchStatus failed(Throwable cause, Instant at) {
        return new LaunchStatus(
                id,
                deployment,
                LaunchState.FAILED,
                submittedAt,
                at,
                hosts,
                UnitOutcome.describe(cause));
    }
}
