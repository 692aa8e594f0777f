package com.p14n.pubsub;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import com.p14n.pubsub.broker.AsyncExecutor;
import com.p14n.pubsub.broker.DefaultExecutor;
import com.p14n.pubsub.connection.CachingClientResolver;
import com.p14n.pubsub.connection.ClientResolver;
import com.p14n.pubsub.connection.ConnectionProvider;
import com.p14n.pubsub.data.BridgeConfig;
import com.p14n.pubsub.data.BridgeResponse;
import com.p14n.pubsub.data.PubsubConfig;
import com.p14n.pubsub.data.PublishResult;
import com.p14n.pubsub.data.SubscribeResult;
import com.p14n.pubsub.error.ConnectionException;
import com.p14n.pubsub.error.PubsubException;
import com.p14n.pubsub.lifecycle.LifecycleScope;
import com.p14n.pubsub.sink.EventSink;
import com.p14n.pubsub.subscription.BatchAccumulator;
import com.p14n.pubsub.subscription.EventNames;
import com.p14n.pubsub.subscription.SubscriptionHandle;
import com.p14n.pubsub.subscription.SubscriptionRegistry;
import com.p14n.pubsub.telemetry.BridgeMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.pubsub.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Bridges pattern subscriptions on a pub/sub broker to an {@link EventSink},
 * delivering what arrives in batches rather than one event per message.
 *
 * <p>
 * Every operation reports failure through {@link BridgeResponse}; exceptions
 * from the broker collaborators never escape.
 * </p>
 *
 * <ul>
 * <li>{@link #publish} resolves a client through the {@link ClientResolver}
 * and never touches subscriptions</li>
 * <li>{@link #startSubscribe} keeps at most one subscription per server,
 * replacing any active one</li>
 * <li>{@link #stopSubscribe} is idempotent</li>
 * <li>{@link #stopAll} cancels the lifecycle scope and stops every server</li>
 * </ul>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var bridge = new PubsubBridge(connections, (eventName, batch) -> ui.send(eventName, batch),
 *         OpenTelemetry.noop());
 * bridge.start();
 * var subscribed = bridge.startSubscribe("local", "orders.*");
 * // batches arrive under subscribed.data().eventName()
 * bridge.stopSubscribe("local");
 * bridge.close();
 * }</pre>
 */
public class PubsubBridge implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PubsubBridge.class);
    private static final String SCOPE_NAME = "pubsub_bridge";

    private final SubscriptionRegistry registry;
    private final ClientResolver clients;
    private final EventSink sink;
    private final AsyncExecutor asyncExecutor;
    private final PubsubConfig config;
    private final Clock clock;
    private final EventNames eventNames;
    private final BridgeMetrics metrics;
    private final Tracer tracer;
    private final List<AutoCloseable> closeables;

    private volatile LifecycleScope scope;

    /**
     * Creates a bridge with default batching, a caching publish client resolver
     * and its own executor.
     *
     * @param connections profiles and clients for both subscribing and
     *                    publishing
     * @param sink        receives the batches
     * @param ot          OpenTelemetry instance for metrics and tracing
     */
    public PubsubBridge(ConnectionProvider connections, EventSink sink, OpenTelemetry ot) {
        this(new SubscriptionRegistry(connections), new CachingClientResolver(connections), sink,
                new DefaultExecutor(1), new BridgeConfig(), Clock.systemUTC(), ot);
    }

    /**
     * Creates a bridge from explicit collaborators. The bridge takes ownership of
     * the client resolver and the executor and closes both in {@link #close()}.
     *
     * @param registry      subscription registry, one per bridge
     * @param clients       resolves clients for publishing
     * @param sink          receives the batches
     * @param asyncExecutor runs flush timers and concurrent dispatch
     * @param config        batching configuration
     * @param clock         source of receipt timestamps and event names
     * @param ot            OpenTelemetry instance for metrics and tracing
     */
    public PubsubBridge(SubscriptionRegistry registry,
            ClientResolver clients,
            EventSink sink,
            AsyncExecutor asyncExecutor,
            PubsubConfig config,
            Clock clock,
            OpenTelemetry ot) {
        this.registry = registry;
        this.clients = clients;
        this.sink = sink;
        this.asyncExecutor = asyncExecutor;
        this.config = config;
        this.clock = clock;
        this.eventNames = new EventNames(config.eventPrefix(), clock);
        this.metrics = new BridgeMetrics(ot.getMeter(SCOPE_NAME));
        this.tracer = ot.getTracer(SCOPE_NAME);
        this.closeables = List.of(clients, asyncExecutor);
    }

    /**
     * Starts the bridge under a fresh root scope.
     */
    public void start() {
        start(LifecycleScope.root("application"));
    }

    /**
     * Starts the bridge under a scope derived from {@code parent}. Cancelling the
     * parent makes every accumulator stop emitting; releasing subscriptions still
     * takes {@link #stopAll()}.
     *
     * @param parent the scope the bridge lives in
     * @throws IllegalStateException if the bridge is already running
     */
    public synchronized void start(LifecycleScope parent) {
        if (scope != null && !scope.isCancelled()) {
            logger.atError().log("Pubsub bridge already started");
            throw new IllegalStateException("Already started");
        }
        scope = parent.child(SCOPE_NAME);
        logger.atInfo().addArgument(scope.name()).log("Pubsub bridge started in scope {}");
    }

    public boolean isRunning() {
        var current = scope;
        return current != null && !current.isCancelled();
    }

    /**
     * Publishes a payload to a channel.
     *
     * @param server  the server key
     * @param channel the channel
     * @param payload the message body
     * @return the broker reported receiver count, or the failure message
     */
    public BridgeResponse<PublishResult> publish(String server, String channel, String payload) {
        try {
            var client = clients.resolve(server);
            long received = processWithTelemetry(tracer, "publish_message",
                    Map.of("server", server, "channel", String.valueOf(channel)),
                    () -> {
                        try {
                            return client.publish(channel, payload);
                        } catch (PubsubException e) {
                            throw new PublishFailure(e);
                        }
                    });
            logger.atDebug()
                    .addArgument(channel)
                    .addArgument(server)
                    .addArgument(received)
                    .log("Published to {} on {}, {} receivers");
            return BridgeResponse.ok(new PublishResult(received));
        } catch (PubsubException e) {
            return publishFailed(server, channel, e);
        } catch (PublishFailure e) {
            if (e.getCause() instanceof ConnectionException) {
                clients.evict(server);
            }
            return publishFailed(server, channel, e.getCause());
        } catch (RuntimeException e) {
            return publishFailed(server, channel, e);
        }
    }

    private BridgeResponse<PublishResult> publishFailed(String server, String channel, Exception e) {
        logger.atWarn()
                .setCause(e)
                .addArgument(channel)
                .addArgument(server)
                .log("Publish to {} on {} failed");
        return BridgeResponse.failed(e.getMessage());
    }

    /**
     * Subscribes to a channel pattern on a server. An active subscription on the
     * same server is stopped first.
     *
     * @param server  the server key
     * @param channel channel or glob pattern, empty for every channel
     * @return the event name batches are emitted under, or the failure message
     */
    public BridgeResponse<SubscribeResult> startSubscribe(String server, String channel) {
        var current = scope;
        if (current == null || current.isCancelled()) {
            return BridgeResponse.failed("pubsub bridge is not running");
        }
        SubscriptionHandle handle = null;
        try {
            handle = registry.resolve(server);
            var pattern = config.patternFor(channel);
            var accumulator = handle.activate(pattern, eventNames.next(server),
                    eventName -> new BatchAccumulator(server, eventName, config, sink, asyncExecutor, current,
                            clock, metrics, tracer));
            logger.atInfo()
                    .addArgument(server)
                    .addArgument(pattern)
                    .addArgument(accumulator.eventName())
                    .log("Subscribed {} to {} as {}");
            return BridgeResponse.ok(new SubscribeResult(accumulator.eventName()));
        } catch (PubsubException | RuntimeException e) {
            if (handle != null) {
                registry.discard(server, handle);
            }
            logger.atWarn()
                    .setCause(e)
                    .addArgument(server)
                    .log("Subscribe on {} failed");
            return BridgeResponse.failed(e.getMessage());
        }
    }

    /**
     * Stops the subscription on a server. Always succeeds.
     *
     * @param server the server key
     * @return a successful response
     */
    public BridgeResponse<Void> stopSubscribe(String server) {
        try {
            if (registry.stop(server)) {
                logger.atInfo().addArgument(server).log("Stopped subscription on {}");
            }
        } catch (RuntimeException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(server)
                    .log("Error stopping subscription on {}");
        }
        return BridgeResponse.ok();
    }

    /**
     * Cancels the bridge scope, then stops the subscription of every registered
     * server.
     */
    public void stopAll() {
        var current = scope;
        if (current != null) {
            current.cancel();
        }
        for (var server : registry.servers()) {
            stopSubscribe(server);
        }
        logger.atInfo().log("Stopped all subscriptions");
    }

    /**
     * Stops everything and releases every client and the executor.
     */
    @Override
    public void close() {
        logger.atInfo().log("Closing pubsub bridge");
        stopAll();
        registry.closeAll();
        for (var c : closeables) {
            try {
                c.close();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(c.getClass().getSimpleName())
                        .log("Error closing {}");
            }
        }
        logger.atInfo().log("Pubsub bridge closed");
    }

    SubscriptionRegistry registry() {
        return registry;
    }

    /**
     * Carries a checked publish failure out of the telemetry wrapper.
     */
    private static final class PublishFailure extends RuntimeException {
        PublishFailure(PubsubException cause) {
            super(cause);
        }

        @Override
        public synchronized PubsubException getCause() {
            return (PubsubException) super.getCause();
        }
    }
}
