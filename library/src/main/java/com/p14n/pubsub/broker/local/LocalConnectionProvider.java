package com.p14n.pubsub.broker.local;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.p14n.pubsub.broker.BrokerClient;
import com.p14n.pubsub.connection.ConnectionProfile;
import com.p14n.pubsub.connection.ConnectionProvider;
import com.p14n.pubsub.error.ConnectionException;

/**
 * Connection provider whose profiles point at {@link LocalBroker} instances
 * living in the same process. A broker is addressed by the profile's
 * {@code host:port}.
 */
public class LocalConnectionProvider implements ConnectionProvider {

    private final Map<String, ConnectionProfile> profiles = new ConcurrentHashMap<>();
    private final Map<String, LocalBroker> brokers = new ConcurrentHashMap<>();
    private final AtomicInteger opened = new AtomicInteger();

    public LocalConnectionProvider addProfile(ConnectionProfile profile) {
        profiles.put(profile.name(), profile);
        return this;
    }

    /**
     * Makes a broker reachable at an address.
     *
     * @param host   host profiles use to reach it
     * @param port   port profiles use to reach it
     * @param broker the broker
     * @return this provider
     */
    public LocalConnectionProvider listen(String host, int port, LocalBroker broker) {
        brokers.put(address(host, port), broker);
        return this;
    }

    /**
     * Registers a profile named after the broker and makes the broker reachable
     * through it.
     *
     * @param broker the broker
     * @return the profile created
     */
    public ConnectionProfile register(LocalBroker broker) {
        var profile = new ConnectionProfile(broker.name(), "local-" + broker.name(), 6379);
        addProfile(profile);
        listen(profile.host(), profile.port(), broker);
        return profile;
    }

    @Override
    public Optional<ConnectionProfile> getProfile(String server) {
        return Optional.ofNullable(profiles.get(server));
    }

    @Override
    public BrokerClient openClient(ConnectionProfile profile) throws ConnectionException {
        var address = address(profile.host(), profile.port());
        var broker = brokers.get(address);
        if (broker == null) {
            throw new ConnectionException("dial tcp " + address + ": connection refused");
        }
        var client = broker.connect();
        opened.incrementAndGet();
        return client;
    }

    /**
     * @return how many clients this provider has opened
     */
    public int openedClients() {
        return opened.get();
    }

    private static String address(String host, int port) {
        return host + ":" + port;
    }
}
