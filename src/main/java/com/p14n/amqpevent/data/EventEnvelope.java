package com.p14n.amqpevent.data;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Wire-level wrapper around an event payload.
 *
 * <p>
 * Serialized as
 * {@code {"event_type": ..., "occurred_at": ..., "service_name": ..., "payload": ...}}
 * where {@code occurred_at} is an RFC 3339 timestamp and {@code payload} is the
 * event specific JSON value.
 * </p>
 *
 * @param eventType   the event name, equal to the routing key it was published
 *                    under
 * @param occurredAt  when the event was published
 * @param serviceName the service that published the event
 * @param payload     the event body, never null ({@link NullNode} when absent)
 */
public record EventEnvelope(@JsonProperty("event_type") String eventType,
        @JsonProperty("occurred_at") Instant occurredAt,
        @JsonProperty("service_name") String serviceName,
        @JsonProperty("payload") JsonNode payload) {

    public EventEnvelope {
        if (payload == null) {
            payload = NullNode.getInstance();
        }
    }
}
