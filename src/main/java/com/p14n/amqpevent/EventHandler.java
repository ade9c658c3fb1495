package com.p14n.amqpevent;

/**
 * Handles the payload of one consumed event.
 *
 * <p>
 * Returning normally acknowledges the delivery. Throwing a
 * {@link com.p14n.amqpevent.data.PayloadBindingException} marks the payload
 * as unprocessable and rejects it without requeue; any other exception,
 * including other {@link com.p14n.amqpevent.data.EnvelopeException}s, hands
 * the delivery to the consumer's redelivery policy.
 * </p>
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * @param context delivery metadata and the processing deadline
     * @param payload the envelope's payload as JSON bytes
     */
    void handle(DeliveryContext context, byte[] payload) throws Exception;
}
