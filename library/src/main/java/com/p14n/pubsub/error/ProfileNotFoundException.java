package com.p14n.pubsub.error;

/**
 * No connection profile exists for the requested server key.
 */
public class ProfileNotFoundException extends PubsubException {

    private final String server;

    public ProfileNotFoundException(String server) {
        super("no connection profile named: " + server);
        this.server = server;
    }

    public String server() {
        return server;
    }
}
