package com.p14n.amqpevent.consumer;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import com.p14n.amqpevent.DeliveryContext;
import com.p14n.amqpevent.EventHandler;
import com.p14n.amqpevent.broker.AsyncExecutor;
import com.p14n.amqpevent.data.EnvelopeCodec;
import com.p14n.amqpevent.data.EnvelopeException;
import com.p14n.amqpevent.data.EventEnvelope;
import com.p14n.amqpevent.data.PayloadBindingException;
import com.p14n.amqpevent.telemetry.BrokerMetrics;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.amqpevent.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Consumes one queue on one channel and runs each delivery through its
 * handler, one at a time, in arrival order.
 *
 * <p>
 * The client library's delivery thread only enqueues; handlers run on a
 * single loop submitted to the dispatch executor. A dispatcher is bound to
 * the channel it was created for and is replaced after every reconnect.
 * </p>
 */
public class DeliveryDispatcher extends DefaultConsumer {
    private static final Logger logger = LoggerFactory.getLogger(DeliveryDispatcher.class);

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_MDC_KEY = "requestId";

    private static final Delivery END = new Delivery(null, null, null);

    private final SubscriptionRegistry registry;
    private final EnvelopeCodec codec;
    private final RedeliveryPolicy redeliveryPolicy;
    private final Deduplicator deduplicator;
    private final DeliveryAttempts attempts;
    private final Duration handlerTimeout;
    private final BrokerMetrics metrics;
    private final OpenTelemetry ot;
    private final Tracer tracer;

    private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
    private volatile Future<?> loop;
    private volatile String tag;

    public DeliveryDispatcher(Channel channel,
            SubscriptionRegistry registry,
            EnvelopeCodec codec,
            RedeliveryPolicy redeliveryPolicy,
            Deduplicator deduplicator,
            DeliveryAttempts attempts,
            Duration handlerTimeout,
            BrokerMetrics metrics,
            OpenTelemetry ot) {
        super(channel);
        this.registry = registry;
        this.codec = codec;
        this.redeliveryPolicy = redeliveryPolicy;
        this.deduplicator = deduplicator;
        this.attempts = attempts;
        this.handlerTimeout = handlerTimeout;
        this.metrics = metrics;
        this.ot = ot;
        this.tracer = ot.getTracer("amqp-event");
    }

    /**
     * Starts the dispatch loop and registers this consumer on the queue with
     * manual acknowledgement.
     */
    public void start(String queue, AsyncExecutor executor) throws IOException {
        loop = executor.submit(() -> {
            run();
            return null;
        });
        try {
            tag = getChannel().basicConsume(queue, false, this);
        } catch (IOException | RuntimeException e) {
            deliveries.offer(END);
            throw e;
        }
        logger.atInfo()
                .addArgument(queue)
                .log("Consuming from queue {}");
    }

    public boolean isRunning() {
        Future<?> f = loop;
        return f != null && !f.isDone();
    }

    @Override
    public void handleDelivery(String consumerTag, Envelope envelope, AMQP.BasicProperties properties,
            byte[] body) {
        deliveries.offer(new Delivery(envelope, properties, body));
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
        abandon();
    }

    @Override
    public void handleCancel(String consumerTag) {
        logger.atWarn()
                .addArgument(consumerTag)
                .log("Consumer {} cancelled by broker");
        deliveries.offer(END);
    }

    /**
     * Ends the loop without settling buffered deliveries. Used once the
     * channel is gone; the broker redelivers whatever was left unacknowledged.
     */
    public void abandon() {
        deliveries.clear();
        deliveries.offer(END);
    }

    /**
     * Cancels the consumer and waits for the delivery being handled to finish
     * and be settled. The handler is never interrupted; a warning is logged
     * each time {@code warnAfter} passes while it is still running.
     */
    public void stop(Duration warnAfter) {
        String consumerTag = tag;
        if (consumerTag != null && getChannel().isOpen()) {
            try {
                getChannel().basicCancel(consumerTag);
            } catch (IOException | ShutdownSignalException e) {
                logger.atDebug()
                        .setCause(e)
                        .log("Error cancelling consumer");
            }
        }
        abandon();
        awaitLoop(warnAfter);
    }

    /**
     * Waits for the dispatch loop to end without cancelling the consumer.
     */
    public void awaitLoop(Duration warnAfter) {
        Future<?> f = loop;
        if (f == null) {
            return;
        }
        while (true) {
            try {
                f.get(warnAfter.toMillis(), TimeUnit.MILLISECONDS);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (TimeoutException e) {
                logger.atWarn()
                        .addArgument(warnAfter)
                        .log("In-flight handler still running after {}, waiting for it to finish");
            } catch (ExecutionException e) {
                logger.atWarn()
                        .setCause(e.getCause())
                        .log("Dispatch loop failed");
                return;
            }
        }
    }

    private void run() {
        while (true) {
            Delivery delivery;
            try {
                delivery = deliveries.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (delivery == END) {
                logger.atDebug().log("Dispatch loop ended");
                return;
            }
            dispatch(delivery);
        }
    }

    void dispatch(Delivery delivery) {
        Envelope envelope = delivery.getEnvelope();
        AMQP.BasicProperties props = delivery.getProperties();
        String routingKey = envelope.getRoutingKey();
        long deliveryTag = envelope.getDeliveryTag();
        Instant deadline = Instant.now().plus(handlerTimeout);
        metrics.recordReceived(routingKey);

        EventEnvelope event;
        byte[] payload;
        try {
            event = codec.decode(delivery.getBody());
            payload = codec.payloadBytes(event);
        } catch (EnvelopeException e) {
            logger.atError()
                    .setCause(e)
                    .addArgument(routingKey)
                    .log("Failed to decode event with routing key {}");
            reject(deliveryTag, routingKey);
            return;
        }

        EventHandler handler = registry.resolve(routingKey);
        if (handler == null) {
            logger.atWarn()
                    .addArgument(routingKey)
                    .log("No handler registered for routing key {}");
            reject(deliveryTag, routingKey);
            return;
        }

        String messageId = props == null ? null : props.getMessageId();
        if (deduplicator.isDuplicate(messageId)) {
            logger.atDebug()
                    .addArgument(messageId)
                    .log("Skipping already processed message {}");
            ack(deliveryTag, routingKey);
            return;
        }

        Map<String, Object> headers = props == null ? null : props.getHeaders();
        long earlierDeliveries = attempts.recordAttempt(messageId, envelope.isRedeliver());
        Object requestHeader = headers == null ? null : headers.get(REQUEST_ID_HEADER);
        String requestId = requestHeader != null ? requestHeader.toString() : messageId;
        DeliveryContext context = new DeliveryContext(messageId, routingKey, envelope.isRedeliver(),
                deliveryTag, headers, event.eventType(), event.occurredAt(), event.serviceName(), requestId,
                deadline, earlierDeliveries);

        Exception failure;
        if (requestId != null) {
            MDC.put(REQUEST_ID_MDC_KEY, requestId);
        }
        try {
            failure = processWithTelemetry(ot, tracer, "process_event", routingKey, messageId, headers,
                    () -> invoke(handler, context, payload));
        } finally {
            MDC.remove(REQUEST_ID_MDC_KEY);
        }

        if (context.isExpired()) {
            logger.atWarn()
                    .addArgument(routingKey)
                    .addArgument(handlerTimeout)
                    .log("Handler for {} exceeded its deadline of {}");
        }

        if (failure == null) {
            attempts.forget(messageId);
            deduplicator.markProcessed(messageId);
            ack(deliveryTag, routingKey);
        } else if (failure instanceof PayloadBindingException) {
            logger.atError()
                    .setCause(failure)
                    .addArgument(routingKey)
                    .log("Unprocessable payload for routing key {}");
            attempts.forget(messageId);
            reject(deliveryTag, routingKey);
        } else if (redeliveryPolicy.shouldRequeue(context)) {
            logger.atError()
                    .setCause(failure)
                    .addArgument(routingKey)
                    .log("Handler failed for routing key {}, requeueing");
            requeue(deliveryTag, routingKey);
        } else {
            logger.atError()
                    .setCause(failure)
                    .addArgument(routingKey)
                    .addArgument(context.deliveryCount() + 1)
                    .log("Handler failed for routing key {} after {} deliveries, rejecting");
            attempts.forget(messageId);
            reject(deliveryTag, routingKey);
        }
    }

    private static Exception invoke(EventHandler handler, DeliveryContext context, byte[] payload) {
        try {
            handler.handle(context, payload);
            return null;
        } catch (Exception e) {
            Span.current().recordException(e);
            return e;
        }
    }

    private void ack(long deliveryTag, String routingKey) {
        try {
            getChannel().basicAck(deliveryTag, false);
            metrics.recordAcked(routingKey);
        } catch (IOException | ShutdownSignalException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(deliveryTag)
                    .log("Failed to ack delivery {}");
        }
    }

    private void requeue(long deliveryTag, String routingKey) {
        try {
            getChannel().basicNack(deliveryTag, false, true);
            metrics.recordRequeued(routingKey);
        } catch (IOException | ShutdownSignalException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(deliveryTag)
                    .log("Failed to nack delivery {}");
        }
    }

    private void reject(long deliveryTag, String routingKey) {
        try {
            getChannel().basicNack(deliveryTag, false, false);
            metrics.recordRejected(routingKey);
        } catch (IOException | ShutdownSignalException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(deliveryTag)
                    .log("Failed to reject delivery {}");
        }
    }
}
