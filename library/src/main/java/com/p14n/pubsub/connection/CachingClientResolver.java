package com.p14n.pubsub.connection;

import java.util.HashMap;
import java.util.Map;

import com.p14n.pubsub.broker.BrokerClient;
import com.p14n.pubsub.error.ProfileNotFoundException;
import com.p14n.pubsub.error.PubsubException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client resolver that opens one client per server on first use and keeps it
 * for later publishes. A client whose connection failed is not cached.
 */
public class CachingClientResolver implements ClientResolver {
    private static final Logger logger = LoggerFactory.getLogger(CachingClientResolver.class);

    private final ConnectionProvider connections;
    private final Map<String, BrokerClient> clients = new HashMap<>();

    public CachingClientResolver(ConnectionProvider connections) {
        this.connections = connections;
    }

    @Override
    public synchronized BrokerClient resolve(String server) throws PubsubException {
        var client = clients.get(server);
        if (client != null) {
            return client;
        }
        var profile = connections.getProfile(server)
                .orElseThrow(() -> new ProfileNotFoundException(server));
        client = connections.openClient(profile);
        clients.put(server, client);
        logger.atDebug().addArgument(server).log("Opened publish client for {}");
        return client;
    }

    /**
     * Closes and forgets the cached client for a server, so the next publish
     * reconnects.
     *
     * @param server the server key
     */
    @Override
    public synchronized void evict(String server) {
        var client = clients.remove(server);
        if (client != null) {
            closeClient(server, client);
        }
    }

    @Override
    public synchronized void close() {
        clients.forEach(this::closeClient);
        clients.clear();
    }

    private void closeClient(String server, BrokerClient client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(server)
                    .log("Error closing publish client for {}");
        }
    }
}
