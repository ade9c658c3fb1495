package com.p14n.amqpevent;

import com.p14n.amqpevent.data.EnvelopeCodec;
import com.p14n.amqpevent.data.EnvelopeException;
import com.p14n.amqpevent.data.PayloadBindingException;

/**
 * Handler that binds the payload to a Java type before handling it. A payload
 * that cannot be bound is rejected without requeue.
 *
 * @param <T> the payload type
 */
public abstract class JsonEventHandler<T> implements EventHandler {

    private final Class<T> type;
    private final EnvelopeCodec codec;

    protected JsonEventHandler(Class<T> type) {
        this(type, new EnvelopeCodec());
    }

    protected JsonEventHandler(Class<T> type, EnvelopeCodec codec) {
        this.type = type;
        this.codec = codec;
    }

    @Override
    public final void handle(DeliveryContext context, byte[] payload) throws Exception {
        T event;
        try {
            event = codec.readPayload(payload, type);
        } catch (EnvelopeException e) {
            throw new PayloadBindingException("Cannot bind payload of " + context.routingKey() + " to "
                    + type.getSimpleName(), e);
        }
        handleEvent(context, event);
    }

    protected abstract void handleEvent(DeliveryContext context, T event) throws Exception;
}
