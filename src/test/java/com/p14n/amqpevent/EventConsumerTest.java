package com.p14n.amqpevent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.amqpevent.broker.ConnectionManager;
import com.p14n.amqpevent.broker.DefaultExecutor;
import com.p14n.amqpevent.consumer.InMemoryDeduplicator;
import com.p14n.amqpevent.consumer.RedeliveryPolicy;
import com.p14n.amqpevent.data.ConfigData;
import com.p14n.amqpevent.data.ConsumerOptions;
import com.p14n.amqpevent.data.EnvelopeCodec;
import com.p14n.amqpevent.data.EnvelopeException;
import com.p14n.amqpevent.telemetry.BrokerMetrics;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;
import io.opentelemetry.api.OpenTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class EventConsumerTest {

    private static final String QUEUE = "geo-events";
    private static final ConfigData CONFIG = new ConfigData("amqp://localhost", "events", "geo-service")
            .withReconnectDelays(Duration.ofMillis(10), Duration.ofMillis(40))
            .withHandlerTimeout(Duration.ofSeconds(5));

    private final EnvelopeCodec codec = new EnvelopeCodec();

    private ConnectionFactory factory;
    private Connection connection;
    private Channel channel;
    private EventConsumer consumer;

    record Region(int id, String name) {
    }

    @BeforeEach
    void setUp() throws Exception {
        factory = mock(ConnectionFactory.class);
        connection = mock(Connection.class);
        channel = openChannel();
        when(factory.newConnection(anyString())).thenReturn(connection);
        when(connection.createChannel()).thenReturn(channel);
        consumer = newConsumer(ConsumerOptions.defaults(QUEUE));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private static Channel openChannel() throws IOException {
        Channel ch = mock(Channel.class);
        when(ch.isOpen()).thenReturn(true);
        when(ch.basicConsume(anyString(), anyBoolean(), any(Consumer.class))).thenReturn("ctag");
        return ch;
    }

    private EventConsumer newConsumer(ConsumerOptions options) {
        return newConsumer(CONFIG, options);
    }

    private EventConsumer newConsumer(ConfigData config, ConsumerOptions options) {
        ConnectionManager manager = new ConnectionManager(config, factory,
                new DefaultExecutor("test-reconnect-%d"), new BrokerMetrics(OpenTelemetry.noop().getMeter("test")));
        return new EventConsumer(config, options, manager, new DefaultExecutor("test-dispatch-%d"),
                OpenTelemetry.noop());
    }

    private static Consumer registeredConsumer(Channel ch) throws IOException {
        ArgumentCaptor<Consumer> captor = ArgumentCaptor.forClass(Consumer.class);
        verify(ch, timeout(2000)).basicConsume(eq(QUEUE), eq(false), captor.capture());
        return captor.getValue();
    }

    private byte[] body(String routingKey, Object payload) throws Exception {
        return codec.encode(codec.wrap(routingKey, Instant.now(), "geo-service", payload));
    }

    private static AMQP.BasicProperties props(String messageId) {
        return new AMQP.BasicProperties.Builder().messageId(messageId).build();
    }

    private static void deliver(Consumer c, long tag, boolean redeliver, String routingKey, String messageId,
            byte[] body) throws IOException {
        c.handleDelivery("ctag", new Envelope(tag, redeliver, "events", routingKey), props(messageId), body);
    }

    @Test
    void patternSubscriptionShouldReceiveMatchingEvent() throws Exception {
        AtomicReference<DeliveryContext> context = new AtomicReference<>();
        AtomicReference<Region> received = new AtomicReference<>();
        AtomicReference<String> requestId = new AtomicReference<>();
        consumer.start();
        consumer.subscribe("region.*", new JsonEventHandler<Region>(Region.class) {
            @Override
            protected void handleEvent(DeliveryContext ctx, Region event) {
                context.set(ctx);
                received.set(event);
                requestId.set(MDC.get("requestId"));
            }
        });

        deliver(registeredConsumer(channel), 1, false, "region.created", "m-1",
                body("region.created", Map.of("id", 1, "name", "North")));

        verify(channel, timeout(2000)).basicAck(1L, false);
        assertEquals(new Region(1, "North"), received.get());
        assertEquals("region.created", context.get().eventType());
        assertEquals("geo-service", context.get().serviceName());
        assertEquals("m-1", context.get().messageId());
        assertEquals("m-1", requestId.get());
        verify(channel).basicQos(0, 1, false);
        verify(channel).queueDeclare(QUEUE, true, false, false, Map.of());
        verify(channel).queueBind(QUEUE, "events", "region.*");
    }

    @Test
    void publishedPayloadShouldArriveUnchanged() throws Exception {
        Channel publishChannel = mock(Channel.class);
        ConnectionManager publishManager = mock(ConnectionManager.class);
        when(publishManager.currentChannel()).thenReturn(Optional.of(publishChannel));
        Map<String, Object> payload = Map.of("id", 1, "name", "North", "tags", List.of("a", "b"),
                "nested", Map.of("ok", true));
        try (EventPublisher publisher = new EventPublisher(CONFIG, publishManager, OpenTelemetry.noop())) {
            publisher.publishEvent("region.created", payload);
        }
        ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(publishChannel).basicPublish(eq("events"), eq("region.created"), eq(false), eq(false),
                props.capture(), body.capture());

        AtomicReference<byte[]> received = new AtomicReference<>();
        consumer.start();
        consumer.subscribe("region.created", (ctx, bytes) -> received.set(bytes));
        registeredConsumer(channel).handleDelivery("ctag", new Envelope(1, false, "events", "region.created"),
                props.getValue(), body.getValue());

        verify(channel, timeout(2000)).basicAck(1L, false);
        ObjectMapper mapper = new ObjectMapper();
        JsonNode expected = mapper.valueToTree(payload);
        assertEquals(expected, mapper.readTree(received.get()));
    }

    @Test
    void subscriptionsMadeBeforeConnectShouldBeBoundOnConnect() throws Exception {
        consumer.subscribe("region.created", (ctx, payload) -> {
        });
        verify(channel, never()).queueBind(anyString(), anyString(), anyString());

        consumer.start();

        verify(channel).queueBind(QUEUE, "events", "region.created");
        registeredConsumer(channel);
        assertTrue(consumer.isConsuming());
    }

    @Test
    void subscribingTwiceShouldBindOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        consumer.start();
        consumer.subscribe("region.created", (ctx, payload) -> calls.incrementAndGet());
        consumer.subscribe("region.created", (ctx, payload) -> calls.incrementAndGet());

        deliver(registeredConsumer(channel), 1, false, "region.created", "m-1", body("region.created", 1));

        verify(channel, timeout(2000)).basicAck(1L, false);
        verify(channel, times(1)).queueBind(QUEUE, "events", "region.created");
        verify(channel, times(1)).basicConsume(eq(QUEUE), eq(false), any(Consumer.class));
        assertEquals(1, calls.get());
    }

    @Test
    void failedHandlerShouldBeRedeliveredThenAcked() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        consumer.start();
        consumer.subscribe("city.updated", (ctx, payload) -> {
            seen.add(ctx.messageId());
            if (!ctx.redelivered()) {
                throw new IllegalStateException("database unavailable");
            }
        });
        Consumer broker = registeredConsumer(channel);
        byte[] body = body("city.updated", Map.of("id", 9));
        doAnswer(invocation -> {
            deliver(broker, 2, true, "city.updated", "m-9", body);
            return null;
        }).when(channel).basicNack(1L, false, true);

        deliver(broker, 1, false, "city.updated", "m-9", body);

        verify(channel, timeout(2000)).basicAck(2L, false);
        verify(channel).basicNack(1L, false, true);
        verify(channel, never()).basicAck(1L, false);
        assertEquals(List.of("m-9", "m-9"), seen);
    }

    @Test
    void undecodableDeliveryShouldBeRejectedWithoutStoppingConsumer() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        consumer.start();
        consumer.subscribe("region.*", (ctx, payload) -> calls.incrementAndGet());
        Consumer broker = registeredConsumer(channel);

        deliver(broker, 1, false, "region.created", "m-1", "not json".getBytes(StandardCharsets.UTF_8));
        deliver(broker, 2, false, "region.created", "m-2", body("region.created", Map.of("id", 2)));

        verify(channel, timeout(2000)).basicAck(2L, false);
        verify(channel).basicNack(1L, false, false);
        assertEquals(1, calls.get());
    }

    @Test
    void deliveryWithoutHandlerShouldBeRejected() throws Exception {
        consumer.start();
        consumer.subscribe("region.created", (ctx, payload) -> {
        });

        deliver(registeredConsumer(channel), 1, false, "city.created", "m-1", body("city.created", 1));

        verify(channel, timeout(2000)).basicNack(1L, false, false);
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void unbindablePayloadShouldBeRejectedWithoutRequeue() throws Exception {
        consumer.start();
        consumer.subscribe("region.created", new JsonEventHandler<Region>(Region.class) {
            @Override
            protected void handleEvent(DeliveryContext ctx, Region event) {
            }
        });

        deliver(registeredConsumer(channel), 1, false, "region.created", "m-1",
                body("region.created", "just a string"));

        verify(channel, timeout(2000)).basicNack(1L, false, false);
    }

    @Test
    void redeliveryPolicyShouldRejectAfterLimit() throws Exception {
        consumer.close();
        consumer = newConsumer(ConsumerOptions.defaults(QUEUE)
                .withRedeliveryPolicy(RedeliveryPolicy.maxDeliveries(2))
                .withDeadLetterExchange("events.dlx"));
        consumer.start();
        consumer.subscribe("city.updated", (ctx, payload) -> {
            throw new IllegalStateException("always fails");
        });
        Consumer broker = registeredConsumer(channel);
        byte[] body = body("city.updated", 1);

        deliver(broker, 1, false, "city.updated", "m-1", body);
        deliver(broker, 2, true, "city.updated", "m-1", body);

        verify(channel, timeout(2000)).basicNack(2L, false, false);
        verify(channel).basicNack(1L, false, true);
        verify(channel).queueDeclare(QUEUE, true, false, false, Map.of("x-dead-letter-exchange", "events.dlx"));
    }

    @Test
    void redeliveryLimitShouldApplyWithoutDeliveryCountHeader() throws Exception {
        consumer.close();
        consumer = newConsumer(ConsumerOptions.defaults(QUEUE)
                .withRedeliveryPolicy(RedeliveryPolicy.maxDeliveries(3)));
        AtomicInteger calls = new AtomicInteger();
        consumer.start();
        consumer.subscribe("city.updated", (ctx, payload) -> {
            calls.incrementAndGet();
            throw new IllegalStateException("always fails");
        });
        Consumer broker = registeredConsumer(channel);
        byte[] body = body("city.updated", 1);

        deliver(broker, 1, false, "city.updated", "m-1", body);
        deliver(broker, 2, true, "city.updated", "m-1", body);
        deliver(broker, 3, true, "city.updated", "m-1", body);

        verify(channel, timeout(2000)).basicNack(3L, false, false);
        verify(channel).basicNack(1L, false, true);
        verify(channel).basicNack(2L, false, true);
        verify(channel, never()).basicNack(3L, false, true);
        assertEquals(3, calls.get());
    }

    @Test
    void envelopeExceptionFromHandlerShouldBeRequeued() throws Exception {
        consumer.start();
        consumer.subscribe("region.created", (ctx, payload) -> {
            throw new EnvelopeException("downstream response unreadable");
        });

        deliver(registeredConsumer(channel), 1, false, "region.created", "m-1", body("region.created", 1));

        verify(channel, timeout(2000)).basicNack(1L, false, true);
        verify(channel, never()).basicNack(1L, false, false);
    }

    @Test
    void deduplicatorShouldSkipProcessedMessages() throws Exception {
        consumer.close();
        consumer = newConsumer(ConsumerOptions.defaults(QUEUE)
                .withDeduplicator(new InMemoryDeduplicator(100, Duration.ofMinutes(1))));
        AtomicInteger calls = new AtomicInteger();
        consumer.start();
        consumer.subscribe("region.created", (ctx, payload) -> calls.incrementAndGet());
        Consumer broker = registeredConsumer(channel);
        byte[] body = body("region.created", 1);

        deliver(broker, 1, false, "region.created", "m-1", body);
        deliver(broker, 2, true, "region.created", "m-1", body);

        verify(channel, timeout(2000)).basicAck(2L, false);
        verify(channel).basicAck(1L, false);
        assertEquals(1, calls.get());
    }

    @Test
    void reconnectShouldRebindAllKeysAndResumeConsuming() throws Exception {
        Connection connection2 = mock(Connection.class);
        Channel channel2 = openChannel();
        when(connection2.createChannel()).thenReturn(channel2);
        when(factory.newConnection(anyString())).thenReturn(connection, connection2);
        CountDownLatch handled = new CountDownLatch(1);
        consumer.start();
        consumer.subscribe("region.*", (ctx, payload) -> handled.countDown());
        consumer.subscribe("city.updated", (ctx, payload) -> {
        });
        registeredConsumer(channel);

        ArgumentCaptor<ShutdownListener> listener = ArgumentCaptor.forClass(ShutdownListener.class);
        verify(connection).addShutdownListener(listener.capture());
        listener.getValue().shutdownCompleted(new ShutdownSignalException(true, false, null, connection));

        Consumer broker2 = registeredConsumer(channel2);
        verify(channel2).queueBind(QUEUE, "events", "region.*");
        verify(channel2).queueBind(QUEUE, "events", "city.updated");
        verify(channel2).queueDeclare(QUEUE, true, false, false, Map.of());

        deliver(broker2, 1, false, "region.deleted", "m-1", body("region.deleted", 1));

        assertTrue(handled.await(2, TimeUnit.SECONDS));
        verify(channel2, timeout(2000)).basicAck(1L, false);
        assertTrue(consumer.isConsuming());
    }

    @Test
    void bindFailureWhileConnectedShouldBeReported() throws Exception {
        doThrow(new IOException("access refused")).when(channel).queueBind(QUEUE, "events", "secret.key");
        consumer.start();

        assertThrows(IOException.class, () -> consumer.subscribe("secret.key", (ctx, payload) -> {
        }));
        assertThrows(IOException.class, () -> consumer.subscribe("secret.key", (ctx, payload) -> {
        }));

        verify(channel, times(2)).queueBind(QUEUE, "events", "secret.key");
    }

    @Test
    void consumeFailureShouldRemoveNewBinding() throws Exception {
        when(channel.basicConsume(anyString(), anyBoolean(), any(Consumer.class)))
                .thenThrow(new IOException("consume refused"));
        consumer.start();

        assertThrows(IOException.class, () -> consumer.subscribe("region.created", (ctx, payload) -> {
        }));

        InOrder inOrder = inOrder(channel);
        inOrder.verify(channel).queueBind(QUEUE, "events", "region.created");
        inOrder.verify(channel).queueUnbind(QUEUE, "events", "region.created");
        assertFalse(consumer.unsubscribe("region.created"));
    }

    @Test
    void unsubscribeShouldRemoveBinding() throws Exception {
        consumer.start();
        consumer.subscribe("region.created", (ctx, payload) -> {
        });

        assertTrue(consumer.unsubscribe("region.created"));
        assertFalse(consumer.unsubscribe("region.created"));

        verify(channel).queueUnbind(QUEUE, "events", "region.created");
    }

    @Test
    void closeShouldLetInFlightHandlerFinish() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        consumer.start();
        consumer.subscribe("region.created", (ctx, payload) -> {
            started.countDown();
            Thread.sleep(200);
        });
        deliver(registeredConsumer(channel), 1, false, "region.created", "m-1", body("region.created", 1));
        assertTrue(started.await(2, TimeUnit.SECONDS));

        consumer.close();

        InOrder inOrder = inOrder(channel, connection);
        inOrder.verify(channel).basicCancel("ctag");
        inOrder.verify(channel).basicAck(1L, false);
        inOrder.verify(channel).close();
        inOrder.verify(connection).close(anyInt());
        assertFalse(consumer.isConsuming());
        assertThrows(IllegalStateException.class, () -> consumer.subscribe("x", (ctx, payload) -> {
        }));
    }

    @Test
    void closeShouldNotInterruptHandlerRunningPastItsTimeout() throws Exception {
        consumer.close();
        consumer = newConsumer(CONFIG.withHandlerTimeout(Duration.ofMillis(100)), ConsumerOptions.defaults(QUEUE));
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        AtomicBoolean finished = new AtomicBoolean();
        consumer.start();
        consumer.subscribe("region.created", (ctx, payload) -> {
            started.countDown();
            try {
                Thread.sleep(700);
                finished.set(true);
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            }
        });
        deliver(registeredConsumer(channel), 1, false, "region.created", "m-1", body("region.created", 1));
        assertTrue(started.await(2, TimeUnit.SECONDS));

        consumer.close();

        assertTrue(finished.get());
        assertFalse(interrupted.get());
        InOrder inOrder = inOrder(channel, connection);
        inOrder.verify(channel).basicAck(1L, false);
        inOrder.verify(channel).close();
        inOrder.verify(connection).close(anyInt());
    }
}
