/* (C)2026 */
package com.ammann.fleetsync.model;

/**
 * A Docker host of the fleet, identified by hostname and daemon port.
 */
public class Host implements FleetEntity<Host> {

    private final String hostname;
    private final int port;
    private String alias;
    private HostStatus status = HostStatus.UNKNOWN;

    public Host(String hostname, int port, String alias) {
        this.hostname = hostname;
        this.port = port;
        this.alias = alias;
    }

    /**
     * Builds the store key of a host.
     *
     * @param hostname the host name or address
     * @param port     the Docker daemon port
     * @return {@code hostname:port}
     */
    public static String keyOf(String hostname, int port) {
        return hostname + ":" + port;
    }

    public String getHostname() {
        return hostname;
    }

    public int getPort() {
        return port;
    }

    public String getAlias() {
        return alias;
    }

    public void setAlias(String alias) {
        this.alias = alias;
    }

    public HostStatus getStatus() {
        return status;
    }

    public void setStatus(HostStatus status) {
        this.status = status;
    }

    /** Returns the alias if one is set, otherwise the key. Used in log lines. */
    public String displayName() {
        return alias == null || alias.isBlank() ? key() : alias;
    }

    @Override
    public String key() {
        return keyOf(hostname, port);
    }

    @Override
    public Host copy() {
        Host copy = new Host(hostname, port, alias);
        copy.status = status;
        return copy;
    }

    @Override
    public String toString() {
        return "Host[" + key() + " " + status + "]";
    }
}
