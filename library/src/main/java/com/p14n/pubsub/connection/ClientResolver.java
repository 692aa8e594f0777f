package com.p14n.pubsub.connection;

import com.p14n.pubsub.broker.BrokerClient;
import com.p14n.pubsub.error.PubsubException;

/**
 * Resolves a client to publish with. Separate from subscription handling:
 * resolving a publish client never creates or touches a subscription.
 */
public interface ClientResolver extends AutoCloseable {

    /**
     * @param server the server key
     * @return a client connected to the server
     * @throws PubsubException if there is no profile or the connection fails
     */
    BrokerClient resolve(String server) throws PubsubException;

    /**
     * Forgets any client held for a server after its connection failed, so the
     * next resolve reconnects.
     *
     * @param server the server key
     */
    default void evict(String server) {
    }

    @Override
    default void close() {
    }
}
