package com.p14n.amqpevent.data;

/**
 * Raised when a payload cannot be bound to the type a handler expects.
 * A delivery whose handler throws this is rejected without requeue.
 */
public class PayloadBindingException extends EnvelopeException {

    public PayloadBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
