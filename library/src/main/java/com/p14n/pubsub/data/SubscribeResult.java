package com.p14n.pubsub.data;

/**
 * @param eventName the name batches for this subscription are emitted under
 */
public record SubscribeResult(String eventName) {
}
