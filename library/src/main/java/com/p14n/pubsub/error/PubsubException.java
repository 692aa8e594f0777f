package com.p14n.pubsub.error;

/**
 * Base class for failures reported by the broker collaborators. These are
 * converted into unsuccessful responses by the bridge and never thrown past it.
 */
public class PubsubException extends Exception {

    public PubsubException(String message) {
        super(message);
    }

    public PubsubException(String message, Throwable cause) {
        super(message, cause);
    }
}
