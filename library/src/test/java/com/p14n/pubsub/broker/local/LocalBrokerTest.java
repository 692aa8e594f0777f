package com.p14n.pubsub.broker.local;

import com.p14n.pubsub.broker.BrokerClient;
import com.p14n.pubsub.broker.BrokerMessage;
import com.p14n.pubsub.broker.DefaultExecutor;
import com.p14n.pubsub.broker.MessageSubscriber;
import com.p14n.pubsub.broker.TestAsyncExecutor;
import com.p14n.pubsub.error.ConnectionException;
import com.p14n.pubsub.error.SubscriptionException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class LocalBrokerTest {

    private LocalBroker broker;
    private BrokerClient client;

    @BeforeEach
    void setUp() throws Exception {
        broker = new LocalBroker("local");
        client = broker.connect();
    }

    @AfterEach
    void tearDown() {
        client.close();
        broker.close();
    }

    private static MessageSubscriber<BrokerMessage> collecting(List<BrokerMessage> into, CountDownLatch latch) {
        return new MessageSubscriber<>() {
            @Override
            public void onMessage(BrokerMessage message) {
                into.add(message);
                latch.countDown();
            }

            @Override
            public void onError(Throwable error) {
            }
        };
    }

    @Test
    void shouldDeliverToMatchingPatternsAndCountReceivers() throws Exception {
        var sport = new CopyOnWriteArrayList<BrokerMessage>();
        var everything = new CopyOnWriteArrayList<BrokerMessage>();
        var latch = new CountDownLatch(2);
        client.subscribePattern("news.sport*", collecting(sport, latch));
        client.subscribePattern("*", collecting(everything, latch));
        client.subscribePattern("weather.*", collecting(new ArrayList<>(), latch));

        long received = client.publish("news.sport", "goal");

        assertEquals(2, received);
        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(new BrokerMessage("news.sport*", "news.sport", "goal"), sport.get(0));
        assertEquals(new BrokerMessage("*", "news.sport", "goal"), everything.get(0));
    }

    @Test
    void shouldReportZeroReceiversWithoutSubscribers() throws Exception {
        assertEquals(0, client.publish("nobody.listens", "hello"));
    }

    @Test
    void shouldDeliverInPublishOrder() throws Exception {
        int count = 500;
        var received = new CopyOnWriteArrayList<BrokerMessage>();
        var latch = new CountDownLatch(count);
        client.subscribePattern("*", collecting(received, latch));

        for (int i = 0; i < count; i++) {
            client.publish("c", String.valueOf(i));
        }

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        for (int i = 0; i < count; i++) {
            assertEquals(String.valueOf(i), received.get(i).payload());
        }
    }

    @Test
    void shouldNotifySubscriberOfErrors() throws Exception {
        AtomicReference<Throwable> caughtError = new AtomicReference<>();
        CountDownLatch counter = new CountDownLatch(1);
        RuntimeException testException = new RuntimeException("test error");

        client.subscribePattern("*", new MessageSubscriber<>() {
            @Override
            public void onMessage(BrokerMessage message) {
                throw testException;
            }

            @Override
            public void onError(Throwable error) {
                caughtError.set(error);
                counter.countDown();
            }
        });
        client.publish("c", "boom");

        assertTrue(counter.await(1, TimeUnit.SECONDS));
        assertSame(testException, caughtError.get());
    }

    @Test
    void shouldStopDeliveringAfterSubscriptionClosed() throws Exception {
        var executor = new TestAsyncExecutor();
        try (var deterministic = new LocalBroker("deterministic", executor)) {
            var c = deterministic.connect();
            var received = new ArrayList<BrokerMessage>();
            var subscription = c.subscribePattern("*", collecting(received, new CountDownLatch(1)));

            assertEquals(1, c.publish("c", "first"));
            executor.runPending();
            assertEquals(1, received.size());

            c.publish("c", "queued");
            subscription.close();
            subscription.close();
            executor.runPending();

            assertTrue(subscription.isClosed());
            assertEquals(1, received.size(), "Queued message is discarded on close");
            assertEquals(0, c.publish("c", "second"));
            assertEquals(0, deterministic.subscriptionCount());
        }
    }

    @Test
    void shouldResumeDeliveryAfterRejectedDrain() throws Exception {
        var rejectOnce = new AtomicBoolean(true);
        var executor = new TestAsyncExecutor() {
            @Override
            public <T> Future<T> submit(Callable<T> task) {
                if (rejectOnce.getAndSet(false)) {
                    throw new RejectedExecutionException("busy");
                }
                return super.submit(task);
            }
        };
        try (var deterministic = new LocalBroker("deterministic", executor)) {
            var c = deterministic.connect();
            var received = new ArrayList<BrokerMessage>();
            c.subscribePattern("*", collecting(received, new CountDownLatch(2)));

            assertEquals(1, c.publish("c", "first"));
            executor.runPending();
            assertTrue(received.isEmpty());

            c.publish("c", "second");
            executor.runPending();

            assertEquals(List.of("first", "second"),
                    received.stream().map(BrokerMessage::payload).collect(Collectors.toList()));
        }
    }

    @Test
    void shouldCloseSubscriptionsWithClient() throws Exception {
        var subscription = client.subscribePattern("*", collecting(new ArrayList<>(), new CountDownLatch(1)));

        client.close();

        assertTrue(subscription.isClosed());
        assertThrows(ConnectionException.class, () -> client.publish("c", "late"));
        assertThrows(SubscriptionException.class,
                () -> client.subscribePattern("*", collecting(new ArrayList<>(), new CountDownLatch(1))));
    }

    @Test
    void shouldRejectInvalidPattern() {
        assertThrows(SubscriptionException.class,
                () -> client.subscribePattern("", collecting(new ArrayList<>(), new CountDownLatch(1))));
    }

    @Test
    void shouldRefuseConnectionsAfterClose() {
        broker.close();

        assertTrue(broker.isClosed());
        assertThrows(ConnectionException.class, () -> broker.connect());
        assertThrows(ConnectionException.class, () -> client.publish("c", "late"));
    }

    @Test
    void shouldHandleConcurrentPublishers() throws Exception {
        int threadCount = 4;
        int perThread = 50;
        var received = new CopyOnWriteArrayList<BrokerMessage>();
        var done = new CountDownLatch(threadCount * perThread);
        var start = new CountDownLatch(1);
        client.subscribePattern("*", collecting(received, done));

        var executor = new DefaultExecutor(1, threadCount);
        try {
            for (int t = 0; t < threadCount; t++) {
                executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        client.publish("c", "m");
                    }
                    return null;
                });
            }
            start.countDown();
            assertTrue(done.await(2, TimeUnit.SECONDS), "Concurrent test did not complete in time");
        } finally {
            executor.close();
        }
        assertEquals(threadCount * perThread, received.size());
    }
}
