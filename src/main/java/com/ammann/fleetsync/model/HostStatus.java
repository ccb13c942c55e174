/* (C)2026 */
package com.ammann.fleetsync.model;

/** Reachability of a Docker host as last observed by a reconciliation pass. */
public enum HostStatus {
    UP,
    DOWN,
    UNKNOWN
}
