package com.p14n.amqpevent.data;

import java.util.Map;

/**
 * Per-publish settings.
 *
 * @param mandatory ask the broker to return the message if no queue is bound
 *                  for its routing key
 * @param immediate AMQP immediate flag; RabbitMQ does not implement it and
 *                  closes the channel when it is set
 * @param headers   custom message headers, copied onto the message
 * @param priority  message priority 0-255, 0 leaves it unset
 */
public record PublishOptions(boolean mandatory,
        boolean immediate,
        Map<String, Object> headers,
        int priority) {

    public static final PublishOptions DEFAULT = new PublishOptions(false, false, Map.of(), 0);

    public PublishOptions {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        if (priority < 0 || priority > 255) {
            throw new IllegalArgumentException("priority must be between 0 and 255");
        }
    }

    public PublishOptions withHeaders(Map<String, Object> headers) {
        return new PublishOptions(mandatory, immediate, headers, priority);
    }

    public PublishOptions withPriority(int priority) {
        return new PublishOptions(mandatory, immediate, headers, priority);
    }

    public PublishOptions withMandatory(boolean mandatory) {
        return new PublishOptions(mandatory, immediate, headers, priority);
    }
}
