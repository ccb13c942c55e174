/* (C)2026 */
package com.ammann.fleetsync.dto;

import java.util.List;

/**
 * What a launch did on one host.
 *
 * @param host         the host key
 * @param outcome      whether the host was launched, failed or never attempted
 * @param containerIds ids of the containers started, dependencies first
 * @param failure      the failure detail, {@code null} unless {@link Outcome#FAILED}
 */
public record HostLaunchOutcome(
        String host, Outcome outcome, List<String> containerIds, String failure) {

    public enum Outcome {
        LAUNCHED,
        FAILED,
        SKIPPED
    }

    public HostLaunchOutcome {
        containerIds = containerIds == null ? List.of() : List.copyOf(containerIds);
    }

    public static HostLaunchOutcome launched(String host, List<String> containerIds) {
        return new HostLaunchOutcome(host, Outcome.LAUNCHED, containerIds, null);
    }

    public static HostLaunchOutcome failed(String host, Throwable cause) {
        return new HostLaunchOutcome(host, Outcome.FAILED, List.of(), UnitOutcome.describe(cause));
    }

    public static HostLaunchOutcome skipped(String host) {
        return new HostLaunchOutcome(host, Outcome.SKIPPED, List.of(), null);
    }
}
