package com.p14n.amqpevent.data;

/**
 * Raised when an event cannot be converted to or from its wire form.
 * On the publish side this is the only failure reported to the caller; on the
 * consume side it marks the delivery as poison.
 */
public class EnvelopeException extends Exception {

    public EnvelopeException(String message) {
        super(message);
    }

    public EnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
