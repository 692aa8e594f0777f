package com.p14n.pubsub.broker.local;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.pubsub.broker.BrokerClient;
import com.p14n.pubsub.broker.BrokerMessage;
import com.p14n.pubsub.broker.MessageSubscriber;
import com.p14n.pubsub.broker.PatternSubscription;
import com.p14n.pubsub.error.ConnectionException;
import com.p14n.pubsub.error.SubscriptionException;

/**
 * Client connection to a {@link LocalBroker}. Closing it closes every
 * subscription opened through it.
 */
class LocalClient implements BrokerClient {

    private final LocalBroker broker;
    private final Set<LocalBroker.LocalSubscription> open = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    LocalClient(LocalBroker broker) {
        this.broker = broker;
    }

    @Override
    public long publish(String channel, String payload) throws ConnectionException {
        if (closed.get()) {
            throw new ConnectionException("Client is closed");
        }
        return broker.publish(channel, payload);
    }

    @Override
    public PatternSubscription subscribePattern(String pattern, MessageSubscriber<BrokerMessage> subscriber)
            throws SubscriptionException {
        if (closed.get()) {
            throw new SubscriptionException("Client is closed");
        }
        var subscription = broker.subscribe(this, pattern, subscriber);
        open.add(subscription);
        return subscription;
    }

    void forget(LocalBroker.LocalSubscription subscription) {
        open.remove(subscription);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            for (var subscription : open) {
                subscription.close();
            }
        }
    }
}
