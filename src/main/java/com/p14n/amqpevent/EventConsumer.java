package com.p14n.amqpevent;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.amqpevent.broker.AsyncExecutor;
import com.p14n.amqpevent.broker.ConnectionListener;
import com.p14n.amqpevent.broker.ConnectionManager;
import com.p14n.amqpevent.broker.DefaultExecutor;
import com.p14n.amqpevent.consumer.DeliveryAttempts;
import com.p14n.amqpevent.consumer.DeliveryDispatcher;
import com.p14n.amqpevent.consumer.SubscriptionRegistry;
import com.p14n.amqpevent.data.BrokerConfig;
import com.p14n.amqpevent.data.ConsumerOptions;
import com.p14n.amqpevent.data.EnvelopeCodec;
import com.p14n.amqpevent.telemetry.BrokerMetrics;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Consumes events from one queue bound to the configured topic exchange.
 *
 * <p>
 * Handlers are registered per routing key or binding pattern; the queue is
 * bound to each key as it is subscribed and rebound after every reconnect.
 * Deliveries are handled one at a time and acknowledged only after their
 * handler returns, giving at-least-once processing.
 * </p>
 *
 * <pre>{@code
 * EventConsumer consumer = new EventConsumer(config, ConsumerOptions.defaults("orders"), openTelemetry);
 * consumer.start();
 * consumer.subscribe("order.*", (ctx, payload) -> process(payload));
 * }</pre>
 */
public class EventConsumer implements ConnectionListener, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventConsumer.class);

    private final BrokerConfig config;
    private final ConsumerOptions options;
    private final ConnectionManager connectionManager;
    private final AsyncExecutor dispatchExecutor;
    private final SubscriptionRegistry registry = new SubscriptionRegistry();
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final BrokerMetrics metrics;
    private final OpenTelemetry ot;
    private final DeliveryAttempts attempts = new DeliveryAttempts(10_000, Duration.ofHours(1));

    private final Object dispatchLock = new Object();
    private volatile DeliveryDispatcher dispatcher;
    // every dispatcher whose loop may still be inside a handler
    private final List<DeliveryDispatcher> dispatchers = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public EventConsumer(BrokerConfig config, ConsumerOptions options, OpenTelemetry ot) {
        this(config, options, new ConnectionManager(config, ot), new DefaultExecutor("amqp-event-dispatch-%d"),
                ot);
    }

    public EventConsumer(BrokerConfig config, ConsumerOptions options, ConnectionManager connectionManager,
            AsyncExecutor dispatchExecutor, OpenTelemetry ot) {
        this.config = config;
        this.options = options;
        this.connectionManager = connectionManager;
        this.dispatchExecutor = dispatchExecutor;
        this.ot = ot;
        this.metrics = new BrokerMetrics(ot.getMeter("amqp_event"));

        connectionManager.addChannelInitializer(this::declareQueue);
        connectionManager.addListener(this);
    }

    private void declareQueue(Channel channel) throws IOException {
        channel.basicQos(options.prefetchSize(), options.prefetchCount(), options.prefetchGlobal());
        channel.queueDeclare(options.queueName(), options.durable(), options.exclusive(), options.autoDelete(),
                options.declareArguments());
    }

    /**
     * Connects to the broker, falling back to background reconnection if it is
     * unavailable.
     */
    public void start() {
        connectionManager.start();
    }

    /**
     * Registers a handler for a routing key or binding pattern. Subscribing the
     * same key again replaces its handler without adding a second binding.
     * While disconnected the subscription is recorded and bound on the next
     * connect.
     *
     * @throws IOException           if the broker rejects the binding or the
     *                               consumer cannot be started
     * @throws IllegalStateException if the consumer is closed
     */
    public void subscribe(String routingKey, EventHandler handler) throws IOException {
        if (closed.get()) {
            throw new IllegalStateException("Consumer is closed");
        }
        boolean added = registry.register(routingKey, handler);
        if (added) {
            metrics.recordSubscriptionAdded(routingKey);
        }

        synchronized (dispatchLock) {
            Optional<Channel> channel = connectionManager.currentChannel();
            if (channel.isEmpty()) {
                logger.atInfo()
                        .addArgument(routingKey)
                        .log("Broker not connected, subscription {} will be bound on connect");
                return;
            }
            Channel ch = channel.get();
            boolean bound = false;
            try {
                if (added) {
                    ch.queueBind(options.queueName(), config.exchange(), routingKey);
                    bound = true;
                }
                ensureDispatching(ch);
            } catch (IOException e) {
                if (added && registry.remove(routingKey)) {
                    metrics.recordSubscriptionRemoved(routingKey);
                }
                if (bound) {
                    unbindQuietly(ch, routingKey);
                }
                throw e;
            } catch (ShutdownSignalException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(routingKey)
                        .log("Channel closed while subscribing {}, it will be bound on reconnect");
                return;
            }
        }
        logger.atInfo()
                .addArgument(routingKey)
                .addArgument(options.queueName())
                .log("Subscribed {} on queue {}");
    }

    private void unbindQuietly(Channel channel, String routingKey) {
        try {
            channel.queueUnbind(options.queueName(), config.exchange(), routingKey);
        } catch (IOException | ShutdownSignalException e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(routingKey)
                    .log("Failed to remove binding {} after subscribe failed");
        }
    }

    /**
     * Removes the handler for a key and unbinds it from the queue.
     *
     * @return true if the key was subscribed
     */
    public boolean unsubscribe(String routingKey) throws IOException {
        if (!registry.remove(routingKey)) {
            return false;
        }
        metrics.recordSubscriptionRemoved(routingKey);
        Optional<Channel> channel = connectionManager.currentChannel();
        if (channel.isPresent()) {
            try {
                channel.get().queueUnbind(options.queueName(), config.exchange(), routingKey);
            } catch (ShutdownSignalException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(routingKey)
                        .log("Channel closed while unsubscribing {}");
            }
        }
        return true;
    }

    public boolean isConsuming() {
        DeliveryDispatcher d = dispatcher;
        return d != null && d.isRunning() && d.getChannel().isOpen();
    }

    public boolean isConnected() {
        return connectionManager.isConnected();
    }

    @Override
    public void onConnected(Channel channel) throws IOException {
        synchronized (dispatchLock) {
            if (registry.isEmpty()) {
                return;
            }
            for (String key : registry.keys()) {
                channel.queueBind(options.queueName(), config.exchange(), key);
            }
            ensureDispatching(channel);
            logger.atInfo()
                    .addArgument(registry.size())
                    .addArgument(options.queueName())
                    .log("Rebound {} subscriptions on queue {}");
        }
    }

    @Override
    public void onDisconnected() {
        DeliveryDispatcher d = dispatcher;
        if (d != null) {
            d.abandon();
        }
    }

    private void ensureDispatching(Channel channel) throws IOException {
        DeliveryDispatcher current = dispatcher;
        if (current != null && current.getChannel() == channel && current.isRunning()) {
            return;
        }
        if (current != null) {
            current.abandon();
        }
        DeliveryDispatcher next = new DeliveryDispatcher(channel, registry, codec, options.redeliveryPolicy(),
                options.deduplicator(), attempts, config.handlerTimeout(), metrics, ot);
        dispatcher = next;
        dispatchers.removeIf(d -> !d.isRunning());
        dispatchers.add(next);
        next.start(options.queueName(), dispatchExecutor);
    }

    /**
     * Stops consuming, waits for any handler in progress to finish and settle
     * its delivery, then closes the connection. Running handlers are never
     * interrupted, however long they take.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (DeliveryDispatcher d : dispatchers) {
            d.stop(config.handlerTimeout());
        }
        dispatchers.clear();
        connectionManager.close();
        dispatchExecutor.close();
        logger.atInfo()
                .addArgument(options.queueName())
                .log("Consumer on queue {} closed");
    }
}
