/* (C)2026 */
package com.ammann.fleetsync.model;

/** Application-level health of a container, derived from its status endpoint. */
public enum ContainerStatus {
    UP,
    DOWN
}
