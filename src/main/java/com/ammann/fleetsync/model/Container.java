/* (C)2026 */
package com.ammann.fleetsync.model;

import java.time.LocalDateTime;

/**
 * A container observed on a host.
 *
 * <p>{@code state} is whatever the Docker daemon reports ("running", "exited", ...), while
 * {@code status} is the application health derived by probing the deployment's status endpoint.
 * Timestamps are local wall-clock time without a zone. The link to an {@link Image} is optional
 * and only present when the image was known at observation or registry sync time.
 */
public class Container implements FleetEntity<Container> {

    private final String id;
    private String hostKey;
    private String imageRef;
    private String imageId;
    private String state;
    private ContainerStatus status = ContainerStatus.DOWN;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private String command;

    public Container(String id, String hostKey) {
        this.id = id;
        this.hostKey = hostKey;
    }

    public String getId() {
        return id;
    }

    public String getHostKey() {
        return hostKey;
    }

    public void setHostKey(String hostKey) {
        this.hostKey = hostKey;
    }

    public String getImageRef() {
        return imageRef;
    }

    public void setImageRef(String imageRef) {
        this.imageRef = imageRef;
    }

    public String getImageId() {
        return imageId;
    }

    public void setImageId(String imageId) {
        this.imageId = imageId;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public boolean isRunning() {
        return "running".equalsIgnoreCase(state);
    }

    public ContainerStatus getStatus() {
        return status;
    }

    public void setStatus(ContainerStatus status) {
        this.status = status;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(LocalDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public LocalDateTime getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(LocalDateTime finishedAt) {
        this.finishedAt = finishedAt;
    }

    public String getCommand() {
        return command;
    }

    public void setCommand(String command) {
        this.command = command;
    }

    @Override
    public String key() {
        return id;
    }

    @Override
    public Container copy() {
        Container copy = new Container(id, hostKey);
        copy.imageRef = imageRef;
        copy.imageId = imageId;
        copy.state = state;
        copy.status = status;
        copy.startedAt = startedAt;
        copy.finishedAt = finishedAt;
        copy.command = command;
        return copy;
    }

    @Override
    public String toString() {
        return "Container[" + id + " on " + hostKey + " " + state + "/" + status + "]";
    }
}
