package com.p14n.pubsub.broker.local;

import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.pubsub.broker.AsyncExecutor;
import com.p14n.pubsub.broker.BrokerClient;
import com.p14n.pubsub.broker.BrokerMessage;
import com.p14n.pubsub.broker.DefaultExecutor;
import com.p14n.pubsub.broker.MessageSubscriber;
import com.p14n.pubsub.broker.PatternSubscription;
import com.p14n.pubsub.error.ConnectionException;
import com.p14n.pubsub.error.SubscriptionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe in-process pub/sub broker with glob pattern subscriptions.
 *
 * <p>
 * Publishing counts every pattern subscription whose pattern matches the
 * channel and queues the message for each of them. Delivery happens on the
 * {@link AsyncExecutor}; each subscription drains its own queue one message at
 * a time, so a subscriber sees messages in publish order.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var broker = new LocalBroker("local");
 * try (var client = broker.connect()) {
 *     client.subscribePattern("orders.*", subscriber);
 *     long received = client.publish("orders.created", "{...}");
 * }
 * }</pre>
 */
public class LocalBroker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LocalBroker.class);

    private final String name;
    private final AsyncExecutor asyncExecutor;
    private final boolean ownsExecutor;
    private final Set<LocalSubscription> subscriptions = new CopyOnWriteArraySet<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public LocalBroker(String name) {
        this(name, new DefaultExecutor(1), true);
    }

    public LocalBroker(String name, AsyncExecutor asyncExecutor) {
        this(name, asyncExecutor, false);
    }

    private LocalBroker(String name, AsyncExecutor asyncExecutor, boolean ownsExecutor) {
        this.name = name;
        this.asyncExecutor = asyncExecutor;
        this.ownsExecutor = ownsExecutor;
    }

    public String name() {
        return name;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Opens a client connection to this broker.
     *
     * @return a new client
     * @throws ConnectionException if the broker is closed
     */
    public BrokerClient connect() throws ConnectionException {
        if (closed.get()) {
            throw new ConnectionException("Broker " + name + " is closed");
        }
        return new LocalClient(this);
    }

    /**
     * Publishes a message to every matching pattern subscription.
     *
     * @param channel the channel to publish on
     * @param payload the message body
     * @return the number of subscriptions the message was queued for
     */
    long publish(String channel, String payload) throws ConnectionException {
        if (closed.get()) {
            throw new ConnectionException("Broker " + name + " is closed");
        }
        if (channel == null) {
            throw new IllegalArgumentException("Channel cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }

        long receivers = 0;
        for (LocalSubscription subscription : subscriptions) {
            if (subscription.glob.matches(channel)) {
                subscription.enqueue(new BrokerMessage(subscription.pattern(), channel, payload));
                receivers++;
            }
        }
        return receivers;
    }

    LocalSubscription subscribe(LocalClient owner, String pattern, MessageSubscriber<BrokerMessage> subscriber)
            throws SubscriptionException {
        if (closed.get()) {
            throw new SubscriptionException("Broker " + name + " is closed");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }
        GlobPattern glob;
        try {
            glob = GlobPattern.compile(pattern);
        } catch (IllegalArgumentException e) {
            throw new SubscriptionException("Invalid pattern: " + pattern, e);
        }
        var subscription = new LocalSubscription(owner, glob, subscriber);
        subscriptions.add(subscription);
        logger.atDebug()
                .addArgument(pattern)
                .addArgument(name)
                .log("Pattern {} subscribed on {}");
        return subscription;
    }

    int subscriptionCount() {
        return subscriptions.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (LocalSubscription subscription : subscriptions) {
            subscription.close();
        }
        subscriptions.clear();
        if (ownsExecutor) {
            asyncExecutor.shutdownNow();
        }
        logger.atInfo().addArgument(name).log("Broker {} closed");
    }

    final class LocalSubscription implements PatternSubscription {
        private final LocalClient owner;
        private final GlobPattern glob;
        private final MessageSubscriber<BrokerMessage> subscriber;
        private final Queue<BrokerMessage> pending = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private final AtomicBoolean subscriptionClosed = new AtomicBoolean(false);

        private LocalSubscription(LocalClient owner, GlobPattern glob, MessageSubscriber<BrokerMessage> subscriber) {
            this.owner = owner;
            this.glob = glob;
            this.subscriber = subscriber;
        }

        @Override
        public String pattern() {
            return glob.pattern();
        }

        @Override
        public boolean isClosed() {
            return subscriptionClosed.get();
        }

        private void enqueue(BrokerMessage message) {
            pending.add(message);
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                try {
                    asyncExecutor.submit(() -> {
                        drain();
                        return null;
                    });
                } catch (RejectedExecutionException e) {
                    draining.set(false);
                    logger.atWarn()
                            .setCause(e)
                            .addArgument(pattern())
                            .addArgument(pending.size())
                            .log("Delivery for {} rejected, {} messages left queued");
                }
            }
        }

        private void drain() {
            try {
                BrokerMessage message;
                while (!subscriptionClosed.get() && (message = pending.poll()) != null) {
                    try {
                        subscriber.onMessage(message);
                    } catch (Exception e) {
                        try {
                            subscriber.onError(e);
                        } catch (Exception nested) {
                            logger.atWarn()
                                    .setCause(nested)
                                    .addArgument(pattern())
                                    .log("Subscriber for {} failed handling an error");
                        }
                    }
                }
            } finally {
                draining.set(false);
            }
            if (!subscriptionClosed.get() && !pending.isEmpty()) {
                scheduleDrain();
            }
        }

        @Override
        public void close() {
            if (subscriptionClosed.compareAndSet(false, true)) {
                subscriptions.remove(this);
                pending.clear();
                owner.forget(this);
                logger.atDebug()
                        .addArgument(pattern())
                        .addArgument(name)
                        .log("Pattern {} unsubscribed on {}");
            }
        }
    }
}
