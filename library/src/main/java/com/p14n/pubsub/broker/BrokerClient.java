package com.p14n.pubsub.broker;

import com.p14n.pubsub.error.ConnectionException;
import com.p14n.pubsub.error.SubscriptionException;

/**
 * A connection to a pub/sub capable broker.
 */
public interface BrokerClient extends AutoCloseable {

    /**
     * Publishes a payload to a channel.
     *
     * @param channel the channel to publish to
     * @param payload the message body
     * @return the number of receivers the broker reported, possibly zero
     * @throws ConnectionException if the broker cannot be reached
     */
    long publish(String channel, String payload) throws ConnectionException;

    /**
     * Subscribes to every channel matching a glob pattern.
     *
     * @param pattern    the pattern, {@code *} for all channels
     * @param subscriber receives every matching message
     * @return the live subscription
     * @throws SubscriptionException if the subscription cannot be established
     */
    PatternSubscription subscribePattern(String pattern, MessageSubscriber<BrokerMessage> subscriber)
            throws SubscriptionException;

    /**
     * Closes the connection and every subscription opened through it.
     */
    @Override
    void close();
}
