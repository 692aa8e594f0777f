package com.p14n.pubsub.vertx;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.p14n.pubsub.broker.MessageSubscriber;
import com.p14n.pubsub.data.BatchedMessage;

import io.vertx.core.Future;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonArray;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives batches published by {@link VertxEventSink} and hands them to a
 * {@link MessageSubscriber} as lists of {@link BatchedMessage}.
 */
public class VertxBatchConsumer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(VertxBatchConsumer.class);

    private final EventBus eventBus;
    private final Map<String, MessageConsumer<JsonArray>> consumers = new ConcurrentHashMap<>();

    public VertxBatchConsumer(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    /**
     * Listens on the address of an event name. A previous listener for the same
     * event name is unregistered.
     *
     * @param eventName  the event name returned when subscribing
     * @param subscriber receives each batch
     * @return completes once the consumer is registered
     */
    public Future<Void> subscribe(String eventName, MessageSubscriber<List<BatchedMessage>> subscriber) {
        MessageConsumer<JsonArray> consumer = eventBus.consumer(eventName);
        consumer.handler(message -> {
            try {
                subscriber.onMessage(VertxEventSink.fromJson(message.body()));
            } catch (Exception e) {
                logger.atError()
                        .addArgument(eventName)
                        .setCause(e)
                        .log("Error processing batch {}");
                subscriber.onError(e);
            }
        });

        var previous = consumers.put(eventName, consumer);
        if (previous != null) {
            previous.unregister();
        }
        logger.atInfo()
                .addArgument(eventName)
                .log("Listening for batches on {}");
        return consumer.completion();
    }

    /**
     * Stops listening on the address of an event name.
     *
     * @param eventName the event name
     */
    public void unsubscribe(String eventName) {
        var consumer = consumers.remove(eventName);
        if (consumer != null) {
            consumer.unregister();
            logger.atInfo()
                    .addArgument(eventName)
                    .log("Stopped listening for batches on {}");
        }
    }

    @Override
    public void close() {
        consumers.values().forEach(MessageConsumer::unregister);
        consumers.clear();
        logger.atInfo().log("VertxBatchConsumer closed");
    }
}
