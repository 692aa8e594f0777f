package com.p14n.pubsub.connection;

import java.util.Optional;

import com.p14n.pubsub.broker.BrokerClient;
import com.p14n.pubsub.error.ConnectionException;

/**
 * Source of connection profiles and the clients opened from them.
 */
public interface ConnectionProvider {

    /**
     * Looks up the profile for a server key.
     *
     * @param server the server key
     * @return the profile, or empty if none is configured
     */
    Optional<ConnectionProfile> getProfile(String server);

    /**
     * Opens a new client for a profile. The caller owns the returned client.
     *
     * @param profile the profile to connect with
     * @return an open client
     * @throws ConnectionException if the broker cannot be reached
     */
    BrokerClient openClient(ConnectionProfile profile) throws ConnectionException;
}
