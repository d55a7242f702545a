package com.p14n.pubsub.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for broker operations, per topic.
 *
 * <ul>
 * <li>messages_published: messages accepted for fan-out</li>
 * <li>messages_delivered: successful writes to a subscriber stream</li>
 * <li>delivery_failures: failed writes, each one evicting a subscriber</li>
 * <li>active_subscribers: current number of registered subscribers</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");

        private final LongCounter publishedMessages;
        private final LongCounter deliveredMessages;
        private final LongCounter deliveryFailures;
        private final LongUpDownCounter activeSubscribers;

        /**
         * Creates a new BrokerMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages published")
                                .build();

                deliveredMessages = meter.counterBuilder("messages_delivered")
                                .setDescription("Number of messages written to subscriber streams")
                                .build();

                deliveryFailures = meter.counterBuilder("delivery_failures")
                                .setDescription("Number of failed writes to subscriber streams")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of active subscribers")
                                .build();
        }

        public void recordPublished(String topic) {
                publishedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDelivered(String topic) {
                deliveredMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDeliveryFailure(String topic) {
                deliveryFailures.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriberAdded(String topic) {
                activeSubscribers.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriberRemoved(String topic) {
                activeSubscribers.add(-1, Attributes.of(TOPIC, topic));
        }
}
