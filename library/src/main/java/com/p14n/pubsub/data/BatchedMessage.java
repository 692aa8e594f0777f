package com.p14n.pubsub.data;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A message held in a batch buffer until the next flush.
 *
 * @param timestamp receipt time in epoch milliseconds, taken when the bridge
 *                  received the message rather than when the broker sent it
 * @param channel   the concrete channel the message arrived on
 * @param payload   the message body, serialised as {@code message}
 */
public record BatchedMessage(long timestamp,
        String channel,
        @JsonProperty("message") String payload) {
}
