package com.p14n.amqpevent.telemetry;

import io.opentelemetry.context.propagation.TextMapGetter;

import java.util.Map;

/**
 * Reads trace context from AMQP message headers. Header values arrive as
 * {@code LongString}s, so every value is read through {@code toString()}.
 */
public class HeadersTextMapGetter implements TextMapGetter<Map<String, Object>> {
    @Override
    public String get(Map<String, Object> carrier, String key) {
        if (carrier == null) {
            return null;
        }
        Object value = carrier.get(key);
        return value == null ? null : value.toString();
    }

    @Override
    public Iterable<String> keys(Map<String, Object> carrier) {
        return carrier.keySet();
    }
}
