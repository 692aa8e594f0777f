package com.p14n.pubsub.error;

/**
 * The broker refused or failed to establish a pattern subscription.
 */
public class SubscriptionException extends PubsubException {

    public SubscriptionException(String message) {
        super(message);
    }

    public SubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
