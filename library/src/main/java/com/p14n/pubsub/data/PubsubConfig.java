package com.p14n.pubsub.data;

/**
 * Configuration for batching and naming of subscriptions.
 */
public interface PubsubConfig {

    /**
     * Gets the period of the flush timer.
     *
     * @return the flush interval in milliseconds
     */
    long flushIntervalMillis();

    /**
     * Gets the buffer length at which a batch is flushed without waiting for the
     * timer. No batch emitted because of it is larger than this.
     *
     * @return the high water mark
     */
    int highWaterMark();

    /**
     * Gets the capacity the batch buffer is created with.
     *
     * @return the initial buffer capacity
     */
    int initialCapacity();

    /**
     * Gets the pattern used when a subscribe request names no channel.
     *
     * @return the default pattern
     */
    String defaultPattern();

    /**
     * Gets the prefix of generated event names.
     *
     * @return the event name prefix
     */
    String eventPrefix();

    DispatchMode dispatchMode();

    /**
     * Resolves the pattern to subscribe with for a requested channel.
     *
     * @param channel requested channel or pattern, may be null or blank
     * @return the requested channel, or the default pattern when none was given
     */
    default String patternFor(String channel) {
        if (channel == null || channel.isBlank()) {
            return defaultPattern();
        }
        return channel;
    }
}
