package com.p14n.pubsub.subscription;

import com.p14n.pubsub.TestClock;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EventNamesTest {

    @Test
    void shouldIncludeServerAndActivationTime() {
        var names = new EventNames("sub", new TestClock(1_700_000_000_123L));

        assertEquals("sub:local:1700000000123", names.next("local"));
    }

    @Test
    void shouldNeverRepeatWithinTheSameMillisecond() {
        var names = new EventNames("sub", new TestClock(1000));

        var first = names.next("local");
        var second = names.next("local");
        var third = names.next("other");

        assertEquals("sub:local:1000", first);
        assertEquals("sub:local:1001", second);
        assertEquals("sub:other:1002", third);
    }

    @Test
    void shouldFollowTheClockOnceItMovesAhead() {
        var clock = new TestClock(1000);
        var names = new EventNames("sub", clock);
        names.next("local");

        clock.advance(500);

        assertEquals("sub:local:1500", names.next("local"));
    }
}
