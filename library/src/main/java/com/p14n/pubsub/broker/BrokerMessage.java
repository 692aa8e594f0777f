package com.p14n.pubsub.broker;

/**
 * A message as delivered by the broker to a pattern subscription.
 *
 * @param pattern the pattern the subscription was registered with
 * @param channel the concrete channel the message was published on
 * @param payload the message body
 */
public record BrokerMessage(String pattern, String channel, String payload) {
}
