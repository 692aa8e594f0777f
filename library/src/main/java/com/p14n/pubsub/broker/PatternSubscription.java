package com.p14n.pubsub.broker;

/**
 * A live pattern subscription on a broker connection. Closing it releases the
 * broker-side resources and stops delivery to the subscriber it was created
 * with.
 */
public interface PatternSubscription extends AutoCloseable {

    String pattern();

    boolean isClosed();

    /**
     * Closes the subscription. Calling this more than once has no effect.
     */
    @Override
    void close();
}
