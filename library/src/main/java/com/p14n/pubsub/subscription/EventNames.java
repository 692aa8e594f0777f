package com.p14n.pubsub.subscription;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates event names of the form {@code <prefix>:<server>:<millis>}. The
 * millisecond stamp is strictly increasing across all servers, so two
 * activations in the same millisecond still get distinct names.
 */
public class EventNames {

    private final String prefix;
    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public EventNames(String prefix, Clock clock) {
        this.prefix = prefix;
        this.clock = clock;
    }

    public String next(String server) {
        long now = clock.millis();
        long stamp = last.updateAndGet(previous -> Math.max(previous + 1, now));
        return prefix + ":" + server + ":" + stamp;
    }
}
