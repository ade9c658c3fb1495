package com.p14n.amqpevent;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Metadata of a delivery, handed to the {@link EventHandler} along with the
 * payload.
 *
 * @param messageId    broker message id, may be null
 * @param routingKey   routing key the event was published with
 * @param redelivered  whether the broker has delivered this message before
 * @param deliveryTag  channel-scoped delivery tag
 * @param headers      message headers, never null
 * @param eventType    event type from the envelope
 * @param occurredAt   event time from the envelope
 * @param serviceName  publishing service from the envelope
 * @param requestId    correlation id: the {@code X-Request-Id} header, or the
 *                     message id when that is absent
 * @param deadline     instant by which the handler should finish
 * @param trackedDeliveries earlier deliveries of this message seen by this
 *                     consumer, used when the broker does not report a count
 */
public record DeliveryContext(String messageId,
        String routingKey,
        boolean redelivered,
        long deliveryTag,
        Map<String, Object> headers,
        String eventType,
        Instant occurredAt,
        String serviceName,
        String requestId,
        Instant deadline,
        long trackedDeliveries) {

    public static final String DELIVERY_COUNT_HEADER = "x-delivery-count";

    public DeliveryContext {
        headers = headers == null ? Map.of() : headers;
    }

    public boolean isExpired() {
        return Instant.now().isAfter(deadline);
    }

    public Duration remaining() {
        Duration d = Duration.between(Instant.now(), deadline);
        return d.isNegative() ? Duration.ZERO : d;
    }

    /**
     * Number of earlier deliveries of this message. Quorum queues report it in
     * the {@code x-delivery-count} header; for other queues the consumer's own
     * count is used.
     */
    public long deliveryCount() {
        Object count = headers.get(DELIVERY_COUNT_HEADER);
        if (count instanceof Number) {
            return ((Number) count).longValue();
        }
        return trackedDeliveries;
    }
}
