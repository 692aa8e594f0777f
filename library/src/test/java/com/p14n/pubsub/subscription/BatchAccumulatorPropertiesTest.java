package com.p14n.pubsub.subscription;

import com.p14n.pubsub.RecordingSink;
import com.p14n.pubsub.TestClock;
import com.p14n.pubsub.broker.BrokerMessage;
import com.p14n.pubsub.broker.TestAsyncExecutor;
import com.p14n.pubsub.data.BridgeConfig;
import com.p14n.pubsub.data.DispatchMode;
import com.p14n.pubsub.lifecycle.LifecycleScope;
import com.p14n.pubsub.telemetry.BridgeMetrics;

import io.opentelemetry.api.OpenTelemetry;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

class BatchAccumulatorPropertiesTest {
    private static final Logger logger = LoggerFactory.getLogger(BatchAccumulatorPropertiesTest.class);

    @Provide
    Arbitrary<Long> randomSeeds() {
        return Arbitraries.longs();
    }

    private static BatchAccumulator accumulator(BridgeConfig config, RecordingSink sink, TestAsyncExecutor executor) {
        var ot = OpenTelemetry.noop();
        return new BatchAccumulator("local", "sub:local:1", config, sink, executor,
                LifecycleScope.root("property"), new TestClock(0),
                new BridgeMetrics(ot.getMeter("test")), ot.getTracer("test"));
    }

    @Property(tries = 50)
    void everyMessageIsEmittedOnceInArrivalOrder(@ForAll("randomSeeds") long seed,
            @ForAll @IntRange(min = 1, max = 2000) int count,
            @ForAll @IntRange(min = 1, max = 400) int highWaterMark) {
        Random random = new Random(seed);
        var executor = new TestAsyncExecutor();
        var sink = new RecordingSink();
        var accumulator = accumulator(new BridgeConfig(300, highWaterMark), sink, executor);
        accumulator.start();

        var sent = new ArrayList<String>();
        for (int i = 0; i < count; i++) {
            var payload = "m" + i;
            sent.add(payload);
            accumulator.onMessage(new BrokerMessage("*", "c", payload));
            if (random.nextInt(20) == 0) {
                executor.fireScheduled();
            }
        }
        executor.fireScheduled();

        assertEquals(sent, sink.payloads());
        for (int size : sink.batchSizes()) {
            assertTrue(size >= 1 && size <= highWaterMark, "Batch size " + size);
        }
        accumulator.stop();
        executor.close();
    }

    @Property(tries = 20)
    void concurrentDispatchLosesAndDuplicatesNothing(@ForAll("randomSeeds") long seed) {
        Random random = new Random(seed);
        int count = random.nextInt(500) + 1;
        logger.atInfo().log("Testing with seed {} and {} messages", seed, count);

        var executor = new TestAsyncExecutor();
        var sink = new RecordingSink();
        var accumulator = accumulator(new BridgeConfig(300, 300, DispatchMode.CONCURRENT), sink, executor);
        accumulator.start();

        for (int i = 0; i < count; i++) {
            accumulator.onMessage(new BrokerMessage("*", "c", "m" + i));
            if (random.nextBoolean()) {
                executor.tick(random, random.nextInt(10) == 0);
            }
        }
        int maxTicks = count * 2 + 10;
        for (int tick = 0; executor.pendingCount() > 0 && tick < maxTicks; tick++) {
            executor.tick(random, tick % 5 == 0);
        }
        executor.fireScheduled();

        List<String> received = sink.payloads();
        assertEquals(count, received.size(), "Not all messages were emitted");
        assertEquals(count, new HashSet<>(received).size(), "A message was emitted twice");
        for (int size : sink.batchSizes()) {
            assertTrue(size >= 1 && size <= 300);
        }
        accumulator.stop();
        executor.close();
    }
}
