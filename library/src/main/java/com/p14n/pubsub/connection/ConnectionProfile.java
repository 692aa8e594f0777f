package com.p14n.pubsub.connection;

/**
 * Connection settings for one named broker server.
 *
 * @param name                 the server key profiles are looked up by
 * @param host                 broker host
 * @param port                 broker port
 * @param username             user, may be null
 * @param password             password, may be null
 * @param database             logical database index
 * @param connectTimeoutMillis how long opening a client may take
 */
public record ConnectionProfile(String name,
        String host,
        int port,
        String username,
        String password,
        int database,
        long connectTimeoutMillis) {

    public ConnectionProfile {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or empty");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or empty");
        }
    }

    public ConnectionProfile(String name, String host, int port) {
        this(name, host, port, null, null, 0, 10_000);
    }

    @Override
    public String toString() {
        return "ConnectionProfile[name=" + name + ", host=" + host + ", port=" + port
                + ", username=" + username + ", database=" + database + "]";
    }
}
