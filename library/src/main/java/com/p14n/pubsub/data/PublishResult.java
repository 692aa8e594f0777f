package com.p14n.pubsub.data;

/**
 * @param received number of receivers the broker reported for the publish
 */
public record PublishResult(long received) {
}
