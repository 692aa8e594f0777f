package com.p14n.pubsub.data;

import java.util.Locale;
import java.util.Properties;

public record BridgeConfig(long flushIntervalMillis,
        int highWaterMark,
        int initialCapacity,
        String defaultPattern,
        String eventPrefix,
        DispatchMode dispatchMode) implements PubsubConfig {

    public static final long DEFAULT_FLUSH_INTERVAL_MILLIS = 300;
    public static final int DEFAULT_HIGH_WATER_MARK = 300;
    public static final int DEFAULT_INITIAL_CAPACITY = 1000;
    public static final String DEFAULT_PATTERN = "*";
    public static final String DEFAULT_EVENT_PREFIX = "sub";

    public BridgeConfig {
        if (flushIntervalMillis <= 0) {
            throw new IllegalArgumentException("flushIntervalMillis must be positive");
        }
        if (highWaterMark <= 0) {
            throw new IllegalArgumentException("highWaterMark must be positive");
        }
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity cannot be negative");
        }
        if (defaultPattern == null || defaultPattern.isBlank()) {
            throw new IllegalArgumentException("defaultPattern cannot be null or empty");
        }
        if (eventPrefix == null || eventPrefix.isBlank()) {
            throw new IllegalArgumentException("eventPrefix cannot be null or empty");
        }
        if (dispatchMode == null) {
            throw new IllegalArgumentException("dispatchMode cannot be null");
        }
    }

    public BridgeConfig(long flushIntervalMillis, int highWaterMark, DispatchMode dispatchMode) {
        this(flushIntervalMillis, highWaterMark, DEFAULT_INITIAL_CAPACITY, DEFAULT_PATTERN, DEFAULT_EVENT_PREFIX,
                dispatchMode);
    }

    public BridgeConfig(long flushIntervalMillis, int highWaterMark) {
        this(flushIntervalMillis, highWaterMark, DispatchMode.SYNCHRONOUS);
    }

    public BridgeConfig() {
        this(DEFAULT_FLUSH_INTERVAL_MILLIS, DEFAULT_HIGH_WATER_MARK);
    }

    /**
     * Reads a configuration from {@code pubsub.*} properties, falling back to
     * the defaults for anything missing.
     *
     * <ul>
     * <li>{@code pubsub.flushIntervalMillis}</li>
     * <li>{@code pubsub.highWaterMark}</li>
     * <li>{@code pubsub.initialCapacity}</li>
     * <li>{@code pubsub.defaultPattern}</li>
     * <li>{@code pubsub.eventPrefix}</li>
     * <li>{@code pubsub.dispatchMode} ({@code synchronous} or {@code concurrent})</li>
     * </ul>
     *
     * @param props the properties to read
     * @return the configuration
     * @throws IllegalArgumentException if a value cannot be parsed or is out of
     *                                  range
     */
    public static BridgeConfig fromProperties(Properties props) {
        return new BridgeConfig(
                longValue(props, "pubsub.flushIntervalMillis", DEFAULT_FLUSH_INTERVAL_MILLIS),
                intValue(props, "pubsub.highWaterMark", DEFAULT_HIGH_WATER_MARK),
                intValue(props, "pubsub.initialCapacity", DEFAULT_INITIAL_CAPACITY),
                props.getProperty("pubsub.defaultPattern", DEFAULT_PATTERN),
                props.getProperty("pubsub.eventPrefix", DEFAULT_EVENT_PREFIX),
                dispatchMode(props.getProperty("pubsub.dispatchMode")));
    }

    private static long longValue(Properties props, String key, long fallback) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static int intValue(Properties props, String key, int fallback) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    private static DispatchMode dispatchMode(String value) {
        if (value == null || value.isBlank()) {
            return DispatchMode.SYNCHRONOUS;
        }
        try {
            return DispatchMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for pubsub.dispatchMode: " + value, e);
        }
    }
}
