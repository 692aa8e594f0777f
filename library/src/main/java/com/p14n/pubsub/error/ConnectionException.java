package com.p14n.pubsub.error;

/**
 * Opening or using a broker connection failed.
 */
public class ConnectionException extends PubsubException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
