package com.p14n.pubsub.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for subscriptions and batch emission.
 * Every measurement carries a {@code server} attribute.
 *
 * <ul>
 * <li>messages_received: messages accepted into a batch buffer</li>
 * <li>messages_dropped: messages lost to a stop or a cancelled scope</li>
 * <li>batches_emitted / messages_emitted: successful sink calls and their
 * sizes</li>
 * <li>emission_failures: sink calls that threw</li>
 * <li>active_subscriptions: currently running accumulators</li>
 * </ul>
 */
public class BridgeMetrics {

        private static final AttributeKey<String> SERVER = AttributeKey.stringKey("server");

        private final LongCounter receivedMessages;
        private final LongCounter droppedMessages;
        private final LongCounter emittedBatches;
        private final LongCounter emittedMessages;
        private final LongCounter emissionFailures;
        private final LongUpDownCounter activeSubscriptions;

        /**
         * Creates a new BridgeMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BridgeMetrics(Meter meter) {
                receivedMessages = meter.counterBuilder("messages_received")
                                .setDescription("Number of messages buffered for emission")
                                .build();

                droppedMessages = meter.counterBuilder("messages_dropped")
                                .setDescription("Number of messages discarded without being emitted")
                                .build();

                emittedBatches = meter.counterBuilder("batches_emitted")
                                .setDescription("Number of batches handed to the event sink")
                                .build();

                emittedMessages = meter.counterBuilder("messages_emitted")
                                .setDescription("Number of messages handed to the event sink")
                                .build();

                emissionFailures = meter.counterBuilder("emission_failures")
                                .setDescription("Number of batches the event sink failed to accept")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of active subscriptions")
                                .build();
        }

        public void recordReceived(String server) {
                receivedMessages.add(1, attributes(server));
        }

        public void recordDropped(String server, long count) {
                if (count > 0) {
                        droppedMessages.add(count, attributes(server));
                }
        }

        /**
         * Records a batch accepted by the event sink.
         *
         * @param server the server the batch was collected from
         * @param size   number of messages in the batch
         */
        public void recordEmitted(String server, int size) {
                emittedBatches.add(1, attributes(server));
                emittedMessages.add(size, attributes(server));
        }

        public void recordEmissionFailure(String server) {
                emissionFailures.add(1, attributes(server));
        }

        public void recordSubscriptionStarted(String server) {
                activeSubscriptions.add(1, attributes(server));
        }

        public void recordSubscriptionStopped(String server) {
                activeSubscriptions.add(-1, attributes(server));
        }

        private static Attributes attributes(String server) {
                return Attributes.of(SERVER, server);
        }
}
