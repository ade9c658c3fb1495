package com.p14n.amqpevent.telemetry;

import java.util.Map;
import java.util.function.Supplier;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        /**
         * Writes the current trace context (W3C {@code traceparent} and friends)
         * into the given message headers.
         */
        public static void injectTraceContext(OpenTelemetry ot, Map<String, Object> headers) {
                TextMapSetter<Map<String, Object>> setter = (carrier, key, value) -> {
                        if (carrier != null) {
                                carrier.put(key, value);
                        }
                };
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), headers, setter);
        }

        public static Context extractTraceContext(OpenTelemetry ot, Map<String, Object> headers) {
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(), headers,
                                new HeadersTextMapGetter());
        }

        /**
         * Runs a consumer-side action in a span parented on the trace context
         * carried by the message headers.
         */
        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, String spanName,
                                                 String routingKey, String messageId,
                                                 Map<String, Object> headers,
                                                 Supplier<T> action) {

                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setSpanKind(SpanKind.CONSUMER)
                                .setAttribute("messaging.destination.routing_key", routingKey)
                                .setAttribute("messaging.message.id", messageId == null ? "" : messageId);
                if (headers != null && !headers.isEmpty()) {
                        sb.setParent(extractTraceContext(ot, headers));
                }
                return inSpan(sb.startSpan(), action);
        }

        public static <T> T processWithTelemetry(Tracer tracer, String spanName, String routingKey,
                                                 Supplier<T> action) {

                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setSpanKind(SpanKind.PRODUCER)
                                .setAttribute("messaging.destination.routing_key", routingKey);
                return inSpan(sb.startSpan(), action);
        }

        private static <T> T inSpan(Span span, Supplier<T> action) {
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException e) {
                        span.recordException(e);
                        throw e;
                } finally {
                        span.end();
                }
        }
}
