package com.p14n.amqpevent;

import java.io.IOException;
import java.time.Instant;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.p14n.amqpevent.broker.ConnectionManager;
import com.p14n.amqpevent.consumer.DeliveryDispatcher;
import com.p14n.amqpevent.data.BrokerConfig;
import com.p14n.amqpevent.data.EnvelopeCodec;
import com.p14n.amqpevent.data.EnvelopeException;
import com.p14n.amqpevent.data.PublishOptions;
import com.p14n.amqpevent.telemetry.BrokerMetrics;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.amqpevent.telemetry.OpenTelemetryFunctions.injectTraceContext;
import static com.p14n.amqpevent.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Publishes events to the configured topic exchange.
 *
 * <p>
 * Each payload is wrapped in an envelope carrying the event type (the routing
 * key), the time of publishing and this service's name, and is sent as a
 * persistent JSON message. Publishing never blocks on broker availability:
 * while disconnected, events are logged and dropped and the connection is
 * re-established in the background.
 * </p>
 *
 * <pre>{@code
 * try (EventPublisher publisher = new EventPublisher(config, openTelemetry)) {
 *     publisher.start();
 *     publisher.publishEvent("order.created", order);
 * }
 * }</pre>
 */
public class EventPublisher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);
    private static final String CONTENT_TYPE = "application/json";
    private static final int PERSISTENT = 2;

    private final BrokerConfig config;
    private final ConnectionManager connectionManager;
    private final EnvelopeCodec codec;
    private final BrokerMetrics metrics;
    private final OpenTelemetry ot;
    private final Tracer tracer;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public EventPublisher(BrokerConfig config, OpenTelemetry ot) {
        this(config, new ConnectionManager(config, ot), ot);
    }

    public EventPublisher(BrokerConfig config, ConnectionManager connectionManager, OpenTelemetry ot) {
        this.config = config;
        this.connectionManager = connectionManager;
        this.codec = new EnvelopeCodec();
        this.metrics = new BrokerMetrics(ot.getMeter("amqp_event"));
        this.ot = ot;
        this.tracer = ot.getTracer("amqp-event");
    }

    /**
     * Connects to the broker. If the broker is unavailable the publisher
     * starts anyway and keeps reconnecting in the background.
     */
    public void start() {
        connectionManager.start();
    }

    public boolean isConnected() {
        return connectionManager.isConnected();
    }

    public void publishEvent(String routingKey, Object payload) throws EnvelopeException {
        publishEvent(routingKey, payload, PublishOptions.DEFAULT);
    }

    /**
     * Publishes one event.
     *
     * @param routingKey the routing key, also used as the event type
     * @param payload    any Jackson-serializable value
     * @param options    per-message flags, headers and priority
     * @throws EnvelopeException     if the payload cannot be serialized
     * @throws IllegalStateException if the publisher is closed
     */
    public void publishEvent(String routingKey, Object payload, PublishOptions options)
            throws EnvelopeException {
        if (closed.get()) {
            throw new IllegalStateException("Publisher is closed");
        }
        if (routingKey == null || routingKey.isEmpty()) {
            throw new IllegalArgumentException("Routing key cannot be null or empty");
        }
        if (options == null) {
            options = PublishOptions.DEFAULT;
        }

        Instant now = Instant.now();
        byte[] body = codec.encode(codec.wrap(routingKey, now, config.serviceName(), payload));

        Optional<Channel> channel = connectionManager.currentChannel();
        if (channel.isEmpty()) {
            logger.atDebug()
                    .addArgument(routingKey)
                    .log("Broker not connected, dropping event {}");
            metrics.recordDropped(routingKey);
            return;
        }

        PublishOptions opts = options;
        boolean sent = processWithTelemetry(tracer, "publish_event", routingKey,
                () -> send(channel.get(), routingKey, body, now, opts));
        if (sent) {
            metrics.recordPublished(routingKey);
            logger.atDebug()
                    .addArgument(routingKey)
                    .log("Published event {}");
        } else {
            metrics.recordDropped(routingKey);
        }
    }

    private boolean send(Channel channel, String routingKey, byte[] body, Instant now, PublishOptions options) {
        String messageId = UUID.randomUUID().toString();
        try {
            channel.basicPublish(config.exchange(), routingKey, options.mandatory(), options.immediate(),
                    properties(messageId, now, options), body);
            return true;
        } catch (IOException | ShutdownSignalException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(routingKey)
                    .addArgument(messageId)
                    .log("Failed to publish event {} with id {}, dropping it");
            return false;
        }
    }

    private AMQP.BasicProperties properties(String messageId, Instant now, PublishOptions options) {
        Map<String, Object> headers = new HashMap<>(options.headers());
        injectTraceContext(ot, headers);
        String requestId = MDC.get(DeliveryDispatcher.REQUEST_ID_MDC_KEY);
        if (requestId != null) {
            headers.put(DeliveryDispatcher.REQUEST_ID_HEADER, requestId);
        }
        AMQP.BasicProperties.Builder builder = new AMQP.BasicProperties.Builder()
                .contentType(CONTENT_TYPE)
                .deliveryMode(PERSISTENT)
                .timestamp(Date.from(now))
                .messageId(messageId)
                .appId(config.serviceName())
                .headers(headers);
        if (options.priority() > 0) {
            builder.priority(options.priority());
        }
        return builder.build();
    }

    /**
     * Closes the broker connection. Further publishes throw
     * {@link IllegalStateException}.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            connectionManager.close();
        }
    }
}
