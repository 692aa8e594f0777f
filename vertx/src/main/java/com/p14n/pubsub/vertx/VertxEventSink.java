package com.p14n.pubsub.vertx;

import java.util.List;
import java.util.stream.Collectors;

import com.p14n.pubsub.data.BatchedMessage;
import com.p14n.pubsub.sink.EventSink;

import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link EventSink} that publishes every batch on the Vert.x
 * {@link EventBus}, using the event name as the address.
 *
 * <p>
 * A batch travels as a {@link JsonArray} of
 * {@code {"timestamp":..., "channel":..., "message":...}} objects, so it needs
 * no codec registration and crosses a clustered event bus unchanged. Every
 * consumer registered on the address receives it.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * Vertx vertx = Vertx.vertx();
 * var bridge = new PubsubBridge(connections, new VertxEventSink(vertx.eventBus()), OpenTelemetry.noop());
 * bridge.start();
 * var eventName = bridge.startSubscribe("local", "orders.*").data().eventName();
 * vertx.eventBus().<JsonArray>consumer(eventName, m -> render(m.body()));
 * }</pre>
 */
public class VertxEventSink implements EventSink {
    private static final Logger logger = LoggerFactory.getLogger(VertxEventSink.class);

    private final EventBus eventBus;
    private final DeliveryOptions deliveryOptions;

    public VertxEventSink(EventBus eventBus) {
        this(eventBus, new DeliveryOptions());
    }

    /**
     * @param eventBus        the bus batches are published on
     * @param deliveryOptions options applied to every publish, for example
     *                        headers or a local-only flag
     */
    public VertxEventSink(EventBus eventBus, DeliveryOptions deliveryOptions) {
        this.eventBus = eventBus;
        this.deliveryOptions = deliveryOptions;
    }

    @Override
    public void emit(String eventName, List<BatchedMessage> batch) {
        eventBus.publish(eventName, toJson(batch), deliveryOptions);
        logger.atDebug()
                .addArgument(batch.size())
                .addArgument(eventName)
                .log("Published batch of {} to {}");
    }

    static JsonArray toJson(List<BatchedMessage> batch) {
        var array = new JsonArray();
        for (var message : batch) {
            array.add(new JsonObject()
                    .put("timestamp", message.timestamp())
                    .put("channel", message.channel())
                    .put("message", message.payload()));
        }
        return array;
    }

    static List<BatchedMessage> fromJson(JsonArray array) {
        return array.stream()
                .map(JsonObject.class::cast)
                .map(o -> new BatchedMessage(o.getLong("timestamp"), o.getString("channel"), o.getString("message")))
                .collect(Collectors.toList());
    }
}
