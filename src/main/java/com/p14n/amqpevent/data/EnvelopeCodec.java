package com.p14n.amqpevent.data;

import java.io.IOException;
import java.time.Instant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON codec for {@link EventEnvelope}.
 *
 * <p>
 * Timestamps are written as RFC 3339 strings rather than epoch numbers.
 * Unknown envelope fields are ignored when decoding, but the body must be a
 * JSON object.
 * </p>
 */
public class EnvelopeCodec {

    private final ObjectMapper mapper;

    public EnvelopeCodec() {
        this(defaultMapper());
    }

    public EnvelopeCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Creates the mapper used for envelopes and typed payloads.
     *
     * @return a new, configured {@link ObjectMapper}
     */
    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Wraps a payload in an envelope. The payload is converted to a JSON tree
     * immediately, so anything Jackson cannot serialize fails here.
     *
     * @param eventType   the event type, normally the routing key
     * @param occurredAt  the event time
     * @param serviceName the publishing service
     * @param payload     any Jackson-serializable value, may be null
     * @return the envelope
     * @throws EnvelopeException if the payload cannot be serialized
     */
    public EventEnvelope wrap(String eventType, Instant occurredAt, String serviceName, Object payload)
            throws EnvelopeException {
        try {
            JsonNode node = payload instanceof JsonNode ? (JsonNode) payload : mapper.valueToTree(payload);
            return new EventEnvelope(eventType, occurredAt, serviceName, node);
        } catch (IllegalArgumentException e) {
            throw new EnvelopeException("Failed to serialize payload of event " + eventType, e);
        }
    }

    public byte[] encode(EventEnvelope envelope) throws EnvelopeException {
        try {
            return mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new EnvelopeException("Failed to serialize event " + envelope.eventType(), e);
        }
    }

    /**
     * Decodes a message body into an envelope.
     *
     * @param body the raw message body
     * @return the decoded envelope
     * @throws EnvelopeException if the body is empty, not JSON, not a JSON object
     *                           or has fields of the wrong type
     */
    public EventEnvelope decode(byte[] body) throws EnvelopeException {
        if (body == null || body.length == 0) {
            throw new EnvelopeException("Message body is empty");
        }
        try {
            JsonNode root = mapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw new EnvelopeException("Message body is not a JSON object");
            }
            return mapper.treeToValue(root, EventEnvelope.class);
        } catch (IOException e) {
            throw new EnvelopeException("Failed to deserialize event envelope", e);
        }
    }

    /**
     * Returns the payload of an envelope re-serialized as JSON bytes, the form
     * handed to {@code EventHandler}s.
     */
    public byte[] payloadBytes(EventEnvelope envelope) throws EnvelopeException {
        try {
            return mapper.writeValueAsBytes(envelope.payload());
        } catch (JsonProcessingException e) {
            throw new EnvelopeException("Failed to serialize payload of event " + envelope.eventType(), e);
        }
    }

    public <T> T readPayload(byte[] payload, Class<T> type) throws EnvelopeException {
        try {
            return mapper.readValue(payload, type);
        } catch (IOException e) {
            throw new EnvelopeException("Failed to deserialize payload as " + type.getSimpleName(), e);
        }
    }
}
