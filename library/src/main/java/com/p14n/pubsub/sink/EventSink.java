package com.p14n.pubsub.sink;

import java.util.List;

import com.p14n.pubsub.data.BatchedMessage;

/**
 * Downstream consumer of batches. Delivery is fire-and-forget: nothing is
 * retried when {@link #emit} throws, the batch is lost.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Delivers a batch.
     *
     * @param eventName the event name of the subscription the batch belongs to
     * @param batch     the messages in arrival order, never empty. The list is
     *                  owned by the sink once passed.
     */
    void emit(String eventName, List<BatchedMessage> batch);
}
