/* (C)2026 */
package com.ammann.fleetsync.runtime;

/**
 * One container as reported by a host snapshot.
 *
 * @param id         the full container id
 * @param state      the runtime state (e.g. "running", "exited")
 * @param imageId    the image id without its {@code sha256:} prefix
 * @param imageRef   the image reference the container was created from, including tag
 * @param startedAt  ISO-8601 start time as reported by the daemon, may be {@code null}
 * @param finishedAt ISO-8601 finish time as reported by the daemon, may be {@code null}
 * @param command    the container command, {@code null} if the daemon reported none
 */
public record ContainerDescriptor(
        String id,
        String state,
        String imageId,
        String imageRef,
        String startedAt,
        String finishedAt,
        String command) {}
