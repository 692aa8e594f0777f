package com.p14n.pubsub.subscription;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.p14n.pubsub.connection.ConnectionProvider;
import com.p14n.pubsub.error.ProfileNotFoundException;
import com.p14n.pubsub.error.PubsubException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps server keys to their {@link SubscriptionHandle}. A handle and its
 * client are created on first use. Every operation holds the registry lock for
 * its full duration, so concurrent first use of a server opens one client.
 *
 * <p>
 * One registry is created per bridge and lives as long as it does.
 * </p>
 */
public class SubscriptionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ConnectionProvider connections;
    private final Map<String, SubscriptionHandle> handles = new HashMap<>();

    public SubscriptionRegistry(ConnectionProvider connections) {
        this.connections = connections;
    }

    /**
     * Returns the handle for a server, connecting on first use.
     *
     * @param server the server key
     * @return the handle
     * @throws ProfileNotFoundException if no profile exists for the server
     * @throws PubsubException          if the connection cannot be opened
     */
    public synchronized SubscriptionHandle resolve(String server) throws PubsubException {
        var handle = handles.get(server);
        if (handle != null) {
            return handle;
        }
        var profile = connections.getProfile(server)
                .orElseThrow(() -> new ProfileNotFoundException(server));
        var client = connections.openClient(profile);
        handle = new SubscriptionHandle(server, client);
        handles.put(server, handle);
        logger.atDebug()
                .addArgument(server)
                .addArgument(profile)
                .log("Connected {} using {}");
        return handle;
    }

    public synchronized Optional<SubscriptionHandle> get(String server) {
        return Optional.ofNullable(handles.get(server));
    }

    /**
     * Removes a handle without touching its subscription or client.
     *
     * @param server the server key
     * @return the removed handle, or null
     */
    public synchronized SubscriptionHandle remove(String server) {
        return handles.remove(server);
    }

    /**
     * Stops the active subscription of a server, if any, then removes its handle
     * and closes the handle's client. Does nothing when the server has no
     * handle.
     *
     * @param server the server key
     * @return whether an active subscription was stopped
     */
    public synchronized boolean stop(String server) {
        var handle = handles.remove(server);
        if (handle == null) {
            return false;
        }
        try {
            return handle.deactivate();
        } finally {
            closeClient(handle);
        }
    }

    /**
     * Drops a handle whose client can no longer be trusted, for example after
     * the broker refused a subscription. The next resolve reconnects. Nothing
     * happens if the server now maps to another handle or the handle is active
     * again.
     *
     * @param server the server key
     * @param handle the handle to drop
     * @return whether the handle was dropped
     */
    public synchronized boolean discard(String server, SubscriptionHandle handle) {
        if (handles.get(server) != handle || handle.isActive()) {
            return false;
        }
        handles.remove(server);
        closeClient(handle);
        logger.atDebug()
                .addArgument(server)
                .log("Discarded connection for {}");
        return true;
    }

    /**
     * Stops and removes every handle, closing all clients.
     */
    public synchronized void closeAll() {
        for (var server : Set.copyOf(handles.keySet())) {
            try {
                stop(server);
            } catch (RuntimeException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(server)
                        .log("Error stopping {}");
            }
        }
    }

    private void closeClient(SubscriptionHandle handle) {
        try {
            handle.client().close();
        } catch (RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(handle.server())
                    .log("Error closing client for {}");
        }
    }

    /**
     * @return a snapshot of the registered server keys
     */
    public synchronized Set<String> servers() {
        return Set.copyOf(handles.keySet());
    }

    public synchronized int size() {
        return handles.size();
    }
}
