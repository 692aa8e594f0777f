package com.p14n.pubsub.subscription;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import com.p14n.pubsub.broker.AsyncExecutor;
import com.p14n.pubsub.broker.BrokerMessage;
import com.p14n.pubsub.broker.MessageSubscriber;
import com.p14n.pubsub.data.BatchedMessage;
import com.p14n.pubsub.data.DispatchMode;
import com.p14n.pubsub.data.PubsubConfig;
import com.p14n.pubsub.lifecycle.LifecycleScope;
import com.p14n.pubsub.sink.EventSink;
import com.p14n.pubsub.telemetry.BridgeMetrics;

import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.p14n.pubsub.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Collects the messages of one subscription activation and hands them to an
 * {@link EventSink} in batches.
 *
 * <p>
 * A batch is emitted when either
 * </p>
 * <ul>
 * <li>the buffer reaches the high water mark, with exactly that many
 * messages, or</li>
 * <li>the flush timer fires and the buffer is not empty, with everything
 * buffered.</li>
 * </ul>
 *
 * <p>
 * The buffer is guarded by its own lock, held only to append or drain. The
 * drained copy is emitted after that lock is released, under a separate emit
 * lock that keeps batches leaving in the order they were drained. A slow sink
 * therefore delays other flushes but never appends.
 * </p>
 *
 * <p>
 * {@link #stop()} is final. Messages buffered when it is called are dropped, no
 * last flush happens, and once it returns the sink is not called again.
 * </p>
 */
public class BatchAccumulator implements MessageSubscriber<BrokerMessage> {
    private static final Logger logger = LoggerFactory.getLogger(BatchAccumulator.class);

    public enum State {
        IDLE,
        ACTIVE,
        STOPPED
    }

    private final String server;
    private final String eventName;
    private final PubsubConfig config;
    private final EventSink sink;
    private final AsyncExecutor asyncExecutor;
    private final LifecycleScope scope;
    private final Clock clock;
    private final BridgeMetrics metrics;
    private final Tracer tracer;

    private final ReentrantLock bufferLock = new ReentrantLock();
    private final ReentrantLock emitLock = new ReentrantLock();
    private final List<BatchedMessage> buffer;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private volatile ScheduledFuture<?> ticker;

    public BatchAccumulator(String server,
            String eventName,
            PubsubConfig config,
            EventSink sink,
            AsyncExecutor asyncExecutor,
            LifecycleScope scope,
            Clock clock,
            BridgeMetrics metrics,
            Tracer tracer) {
        this.server = server;
        this.eventName = eventName;
        this.config = config;
        this.sink = sink;
        this.asyncExecutor = asyncExecutor;
        this.scope = scope;
        this.clock = clock;
        this.metrics = metrics;
        this.tracer = tracer;
        this.buffer = new ArrayList<>(config.initialCapacity());
    }

    /**
     * Starts the flush timer. Messages delivered before this are dropped.
     *
     * @throws IllegalStateException if already started or stopped
     */
    public void start() {
        if (!state.compareAndSet(State.IDLE, State.ACTIVE)) {
            throw new IllegalStateException("Accumulator " + eventName + " is " + state.get());
        }
        long interval = config.flushIntervalMillis();
        ticker = asyncExecutor.scheduleAtFixedRate(this::onTick, interval, interval, TimeUnit.MILLISECONDS);
        metrics.recordSubscriptionStarted(server);
        logger.atDebug()
                .addArgument(eventName)
                .addArgument(interval)
                .log("Accumulator {} started, flushing every {}ms");
    }

    @Override
    public void onMessage(BrokerMessage message) {
        if (config.dispatchMode() == DispatchMode.SYNCHRONOUS) {
            accept(message);
            return;
        }
        try {
            asyncExecutor.submit(() -> {
                accept(message);
                return null;
            });
        } catch (RejectedExecutionException e) {
            metrics.recordDropped(server, 1);
            logger.atDebug()
                    .addArgument(eventName)
                    .log("Executor rejected a message for {}, dropped");
        }
    }

    @Override
    public void onError(Throwable error) {
        logger.atWarn()
                .setCause(error)
                .addArgument(eventName)
                .log("Error delivering to subscription {}");
    }

    private void accept(BrokerMessage message) {
        if (!isRunning()) {
            metrics.recordDropped(server, 1);
            return;
        }
        var batched = new BatchedMessage(clock.millis(), message.channel(), message.payload());
        boolean full;
        bufferLock.lock();
        try {
            // stop() clears the buffer under this lock
            if (state.get() != State.ACTIVE) {
                metrics.recordDropped(server, 1);
                return;
            }
            buffer.add(batched);
            full = buffer.size() >= config.highWaterMark();
        } finally {
            bufferLock.unlock();
        }
        metrics.recordReceived(server);
        if (full) {
            flush(true);
        }
    }

    private void onTick() {
        if (!isRunning()) {
            return;
        }
        // anything thrown here would cancel the fixed-rate schedule
        try {
            flush(false);
        } catch (Throwable t) {
            logger.atError()
                    .setCause(t)
                    .addArgument(eventName)
                    .log("Flush timer for {} failed");
        }
    }

    /**
     * Drains and emits. A high water flush takes exactly one full batch and does
     * nothing if another flush got there first.
     */
    private void flush(boolean highWater) {
        emitLock.lock();
        try {
            List<BatchedMessage> batch = drain(highWater);
            if (batch.isEmpty()) {
                return;
            }
            if (!isRunning()) {
                metrics.recordDropped(server, batch.size());
                return;
            }
            emit(batch);
        } finally {
            emitLock.unlock();
        }
    }

    private List<BatchedMessage> drain(boolean highWater) {
        bufferLock.lock();
        try {
            int size = buffer.size();
            int count = highWater ? (size >= config.highWaterMark() ? config.highWaterMark() : 0) : size;
            if (count == 0) {
                return List.of();
            }
            var head = buffer.subList(0, count);
            var batch = new ArrayList<>(head);
            head.clear();
            return batch;
        } finally {
            bufferLock.unlock();
        }
    }

    private void emit(List<BatchedMessage> batch) {
        int size = batch.size();
        try {
            processWithTelemetry(tracer, "emit_batch",
                    Map.of("server", server, "event.name", eventName, "batch.size", String.valueOf(size)),
                    () -> {
                        sink.emit(eventName, batch);
                        return null;
                    });
            metrics.recordEmitted(server, size);
            logger.atDebug()
                    .addArgument(size)
                    .addArgument(eventName)
                    .log("Emitted {} messages to {}");
        } catch (RuntimeException e) {
            metrics.recordEmissionFailure(server);
            logger.atWarn()
                    .setCause(e)
                    .addArgument(size)
                    .addArgument(eventName)
                    .log("Event sink failed, {} messages for {} lost");
        }
    }

    /**
     * Stops the accumulator. Waits for an emission already in progress, so no
     * sink call happens after this returns, unless stop is called from inside
     * the sink itself.
     */
    public void stop() {
        State previous = state.getAndSet(State.STOPPED);
        if (previous == State.STOPPED) {
            return;
        }
        var t = ticker;
        if (t != null) {
            t.cancel(false);
        }
        emitLock.lock();
        emitLock.unlock();

        int dropped;
        bufferLock.lock();
        try {
            dropped = buffer.size();
            buffer.clear();
        } finally {
            bufferLock.unlock();
        }
        metrics.recordDropped(server, dropped);
        if (previous == State.ACTIVE) {
            metrics.recordSubscriptionStopped(server);
        }
        logger.atDebug()
                .addArgument(eventName)
                .addArgument(dropped)
                .log("Accumulator {} stopped, {} buffered messages dropped");
    }

    private boolean isRunning() {
        return state.get() == State.ACTIVE && !scope.isCancelled();
    }

    public State state() {
        return state.get();
    }

    public String eventName() {
        return eventName;
    }

    public String server() {
        return server;
    }

    /**
     * @return number of messages buffered and not yet emitted
     */
    public int pending() {
        bufferLock.lock();
        try {
            return buffer.size();
        } finally {
            bufferLock.unlock();
        }
    }
}
