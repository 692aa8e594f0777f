package com.p14n.pubsub.subscription;

import java.util.function.Function;

import com.p14n.pubsub.broker.BrokerClient;
import com.p14n.pubsub.broker.PatternSubscription;
import com.p14n.pubsub.error.SubscriptionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscription state for one server: the client it owns and, while a
 * subscribe is active, the pattern subscription and the accumulator fed by it.
 * At most one of those pairs exists at a time.
 */
public class SubscriptionHandle {
    private static final Logger logger = LoggerFactory.getLogger(SubscriptionHandle.class);

    private final String server;
    private final BrokerClient client;

    private PatternSubscription subscription;
    private BatchAccumulator accumulator;

    public SubscriptionHandle(String server, BrokerClient client) {
        this.server = server;
        this.client = client;
    }

    /**
     * Starts a new activation, tearing down the current one first.
     *
     * @param pattern   the pattern to subscribe to
     * @param eventName the event name for the new activation
     * @param factory   creates the accumulator for an event name
     * @return the running accumulator
     * @throws SubscriptionException if the broker refuses the subscription. The
     *                               handle is left inactive.
     */
    public synchronized BatchAccumulator activate(String pattern, String eventName,
            Function<String, BatchAccumulator> factory) throws SubscriptionException {
        if (deactivate()) {
            logger.atInfo()
                    .addArgument(server)
                    .log("Replaced the active subscription on {}");
        }
        var next = factory.apply(eventName);
        next.start();
        try {
            subscription = client.subscribePattern(pattern, next);
        } catch (SubscriptionException | RuntimeException e) {
            next.stop();
            throw e;
        }
        accumulator = next;
        return next;
    }

    /**
     * Closes the subscription and stops its accumulator.
     *
     * @return false if nothing was active
     */
    public synchronized boolean deactivate() {
        if (subscription == null) {
            return false;
        }
        try {
            subscription.close();
        } finally {
            accumulator.stop();
            subscription = null;
            accumulator = null;
        }
        return true;
    }

    public synchronized boolean isActive() {
        return subscription != null;
    }

    /**
     * @return the event name of the active activation, or null
     */
    public synchronized String eventName() {
        return accumulator == null ? null : accumulator.eventName();
    }

    public synchronized BatchAccumulator accumulator() {
        return accumulator;
    }

    public String server() {
        return server;
    }

    public BrokerClient client() {
        return client;
    }
}
