package com.p14n.amqpevent.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for publish and consume operations.
 *
 * <p>
 * Counters are attributed by routing key:
 * </p>
 * <ul>
 * <li>messages_published: messages handed to the broker</li>
 * <li>messages_dropped: messages discarded because no channel was available</li>
 * <li>messages_received: deliveries taken off the queue</li>
 * <li>messages_acked: deliveries acknowledged after successful handling</li>
 * <li>messages_requeued: deliveries returned to the queue after a handler
 * failure</li>
 * <li>messages_rejected: deliveries dropped as poison, unroutable or out of
 * attempts</li>
 * <li>active_subscriptions: registered routing keys</li>
 * <li>reconnect_attempts: dial attempts made by the reconnect loop</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> ROUTING_KEY = AttributeKey.stringKey("routing_key");

        private final LongCounter publishedMessages;
        private final LongCounter droppedMessages;
        private final LongCounter receivedMessages;
        private final LongCounter ackedMessages;
        private final LongCounter requeuedMessages;
        private final LongCounter rejectedMessages;
        private final LongUpDownCounter activeSubscriptions;
        private final LongCounter reconnectAttempts;

        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages published")
                                .build();

                droppedMessages = meter.counterBuilder("messages_dropped")
                                .setDescription("Number of messages dropped while the broker was unreachable")
                                .build();

                receivedMessages = meter.counterBuilder("messages_received")
                                .setDescription("Number of deliveries received")
                                .build();

                ackedMessages = meter.counterBuilder("messages_acked")
                                .setDescription("Number of deliveries acknowledged")
                                .build();

                requeuedMessages = meter.counterBuilder("messages_requeued")
                                .setDescription("Number of deliveries requeued after a handler failure")
                                .build();

                rejectedMessages = meter.counterBuilder("messages_rejected")
                                .setDescription("Number of deliveries rejected without requeue")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of registered routing keys")
                                .build();

                reconnectAttempts = meter.counterBuilder("reconnect_attempts")
                                .setDescription("Number of broker reconnect attempts")
                                .build();
        }

        public void recordPublished(String routingKey) {
                publishedMessages.add(1, attributes(routingKey));
        }

        public void recordDropped(String routingKey) {
                droppedMessages.add(1, attributes(routingKey));
        }

        public void recordReceived(String routingKey) {
                receivedMessages.add(1, attributes(routingKey));
        }

        public void recordAcked(String routingKey) {
                ackedMessages.add(1, attributes(routingKey));
        }

        public void recordRequeued(String routingKey) {
                requeuedMessages.add(1, attributes(routingKey));
        }

        public void recordRejected(String routingKey) {
                rejectedMessages.add(1, attributes(routingKey));
        }

        public void recordSubscriptionAdded(String routingKey) {
                activeSubscriptions.add(1, attributes(routingKey));
        }

        public void recordSubscriptionRemoved(String routingKey) {
                activeSubscriptions.add(-1, attributes(routingKey));
        }

        public void recordReconnectAttempt() {
                reconnectAttempts.add(1);
        }

        private static Attributes attributes(String routingKey) {
                return Attributes.of(ROUTING_KEY, routingKey == null ? "" : routingKey);
        }
}
