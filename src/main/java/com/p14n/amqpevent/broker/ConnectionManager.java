package com.p14n.amqpevent.broker;

import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.amqpevent.data.BrokerConfig;
import com.p14n.amqpevent.telemetry.BrokerMetrics;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;

import io.opentelemetry.api.OpenTelemetry;

/**
 * Owns the single logical connection and channel to the broker.
 *
 * <p>
 * The manager dials the broker, declares the topic exchange on every
 * (re)connect, watches for unexpected closure and drives an unbounded
 * reconnect loop with exponential backoff (1s, 2s, 4s ... capped at 30s by
 * default) until it succeeds or {@link #close()} is called.
 * </p>
 *
 * <p>
 * The live connection/channel pair is guarded by a read/write lock. Readers
 * take the read lock only to snapshot the channel via
 * {@link #currentChannel()}; the write lock is held only while a pair is
 * swapped in or cleared. Connect attempts are serialized, and at most one
 * reconnect loop runs at a time.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var manager = new ConnectionManager(config, openTelemetry);
 * manager.addListener(channel -> log.info("connected"));
 * manager.start();
 * manager.currentChannel().ifPresent(ch -> ...);
 * manager.close();
 * }</pre>
 */
public class ConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);
    private static final int CLOSE_TIMEOUT_MILLIS = 5000;

    private final BrokerConfig config;
    private final ConnectionFactory factory;
    private final AsyncExecutor executor;
    private final BrokerMetrics metrics;

    private final List<ChannelInitializer> initializers = new CopyOnWriteArrayList<>();
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Future<?>> tasks = new CopyOnWriteArrayList<>();

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Connection connection;
    private Channel channel;
    private long generation;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private final Object dialLock = new Object();
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch closeSignal = new CountDownLatch(1);

    /**
     * Creates a manager for the broker described by {@code config}.
     *
     * @param config broker settings
     * @param ot     OpenTelemetry instance for metrics
     * @throws IllegalArgumentException if the broker URL is malformed
     */
    public ConnectionManager(BrokerConfig config, OpenTelemetry ot) {
        this(config, createFactory(config), new DefaultExecutor("amqp-event-reconnect-%d"),
                new BrokerMetrics(ot.getMeter("amqp_event")));
    }

    public ConnectionManager(BrokerConfig config, ConnectionFactory factory, AsyncExecutor executor,
            BrokerMetrics metrics) {
        this.config = config;
        this.factory = factory;
        this.executor = executor;
        this.metrics = metrics;
    }

    private static ConnectionFactory createFactory(BrokerConfig config) {
        ConnectionFactory factory = new ConnectionFactory();
        // recovery is driven by this class; the client's own would race with it
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);
        factory.setConnectionTimeout((int) config.connectionTimeout().toMillis());
        if (hasUrl(config)) {
            try {
                factory.setUri(config.url());
            } catch (URISyntaxException | GeneralSecurityException e) {
                throw new IllegalArgumentException("Invalid broker URL", e);
            }
        }
        return factory;
    }

    private static boolean hasUrl(BrokerConfig config) {
        return config.url() != null && !config.url().isBlank();
    }

    /**
     * Adds an initializer run on every new channel, after the exchange has been
     * declared. Must be called before {@link #start()}.
     */
    public void addChannelInitializer(ChannelInitializer initializer) {
        initializers.add(initializer);
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(listener);
    }

    /**
     * Connects once and falls back to the background reconnect loop if that
     * fails. Without a configured URL the manager stays disconnected and only
     * logs a warning.
     */
    public void start() {
        ensureOpen();
        if (!hasUrl(config)) {
            logger.atWarn().log("Broker URL not set, events will not be published or consumed");
            return;
        }
        try {
            connect();
        } catch (IOException e) {
            logger.atError()
                    .setCause(e)
                    .log("Failed to connect to broker");
            scheduleReconnect();
        }
    }

    /**
     * Dials the broker, creates a channel and declares the exchange. Does
     * nothing if already connected.
     *
     * @throws IOException           if dialing, channel creation, a declaration
     *                               or a listener fails
     * @throws IllegalStateException if the manager is closed
     */
    public void connect() throws IOException {
        ensureOpen();
        if (!hasUrl(config)) {
            throw new IOException("Broker URL not configured");
        }
        synchronized (dialLock) {
            ensureOpen();
            if (isConnected()) {
                return;
            }
            state = ConnectionState.CONNECTING;
            Connection newConnection = null;
            Channel newChannel;
            long gen;
            try {
                newConnection = factory.newConnection(config.connectionName());
                newChannel = newConnection.createChannel();
                newChannel.exchangeDeclare(config.exchange(), BuiltinExchangeType.TOPIC, true, false, false, null);
                for (ChannelInitializer initializer : initializers) {
                    initializer.initialize(newChannel);
                }
                gen = install(newConnection, newChannel);
            } catch (IOException | TimeoutException | RuntimeException e) {
                state = ConnectionState.DISCONNECTED;
                abort(newConnection);
                throw e instanceof IOException ? (IOException) e
                        : new IOException("Failed to connect to broker", e);
            }

            watch(newConnection, newChannel, gen);

            try {
                for (ConnectionListener listener : listeners) {
                    listener.onConnected(newChannel);
                }
            } catch (IOException | RuntimeException e) {
                drop(gen);
                throw e instanceof IOException ? (IOException) e
                        : new IOException("Failed to set up subscriptions", e);
            }
        }
        logger.atInfo()
                .addArgument(config.exchange())
                .log("Connected to broker, exchange {} declared");
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public ConnectionState state() {
        return state;
    }

    /**
     * Snapshots the live channel.
     *
     * @return the channel of the current connection, or empty while
     *         disconnected
     */
    public Optional<Channel> currentChannel() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(channel);
        } finally {
            lock.readLock().unlock();
        }
    }

    public String exchange() {
        return config.exchange();
    }

    private long install(Connection newConnection, Channel newChannel) {
        lock.writeLock().lock();
        try {
            connection = newConnection;
            channel = newChannel;
            state = ConnectionState.CONNECTED;
            return ++generation;
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void watch(Connection newConnection, Channel newChannel, long gen) {
        newConnection.addShutdownListener(cause -> onShutdown(gen, cause));
        newChannel.addShutdownListener(cause -> {
            // connection-level failures are reported by the connection listener
            if (!cause.isHardError()) {
                onShutdown(gen, cause);
            }
        });
    }

    private void onShutdown(long gen, ShutdownSignalException cause) {
        if (cause.isInitiatedByApplication()) {
            return;
        }
        Connection lost;
        lock.writeLock().lock();
        try {
            if (gen != generation || connection == null) {
                return;
            }
            lost = connection;
            connection = null;
            channel = null;
            if (state == ConnectionState.CONNECTED) {
                state = ConnectionState.DISCONNECTED;
            }
        } finally {
            lock.writeLock().unlock();
        }

        logger.atWarn()
                .addArgument(cause.getMessage())
                .log("Broker connection closed: {}");
        abort(lost);
        notifyDisconnected();
        scheduleReconnect();
    }

    private void drop(long gen) {
        Connection dropped = null;
        lock.writeLock().lock();
        try {
            if (gen == generation && connection != null) {
                dropped = connection;
                connection = null;
                channel = null;
                state = ConnectionState.DISCONNECTED;
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (dropped != null) {
            abort(dropped);
            notifyDisconnected();
        }
    }

    private void notifyDisconnected() {
        for (ConnectionListener listener : listeners) {
            try {
                listener.onDisconnected();
            } catch (RuntimeException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(listener.getClass().getSimpleName())
                        .log("Error notifying {} of disconnect");
            }
        }
    }

    void scheduleReconnect() {
        if (closed.get()) {
            return;
        }
        if (!reconnecting.compareAndSet(false, true)) {
            logger.atDebug().log("Reconnect already in progress");
            return;
        }
        try {
            tasks.removeIf(Future::isDone);
            tasks.add(executor.submit(() -> {
                reconnectLoop();
                return null;
            }));
        } catch (RejectedExecutionException e) {
            reconnecting.set(false);
            logger.atWarn()
                    .setCause(e)
                    .log("Reconnect loop could not be scheduled");
        }
    }

    private void reconnectLoop() {
        ExponentialBackoff backoff = new ExponentialBackoff(config.reconnectInitialDelay(),
                config.reconnectMaxDelay());
        try {
            while (!closed.get()) {
                Duration delay = backoff.next();
                logger.atInfo()
                        .addArgument(delay)
                        .log("Trying to reconnect to broker in {}");
                if (awaitClose(delay)) {
                    logger.atInfo().log("Connection manager closed, aborting reconnection");
                    return;
                }
                metrics.recordReconnectAttempt();
                try {
                    connect();
                    logger.atInfo().log("Successfully reconnected to broker");
                    return;
                } catch (IOException | RuntimeException e) {
                    logger.atError()
                            .setCause(e)
                            .log("Failed to reconnect to broker");
                }
            }
        } finally {
            reconnecting.set(false);
            // a drop that raced with the end of this loop would otherwise be missed
            if (!closed.get() && !isConnected()) {
                scheduleReconnect();
            }
        }
    }

    private boolean awaitClose(Duration delay) {
        try {
            return closeSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Connection manager is closed");
        }
    }

    /**
     * Stops reconnection and closes the channel and connection. Returns after
     * the reconnect loop has exited. Calling it more than once has no effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        logger.atInfo().log("Closing broker connection");
        state = ConnectionState.CLOSING;
        closeSignal.countDown();

        Connection c;
        Channel ch;
        synchronized (dialLock) {
            lock.writeLock().lock();
            try {
                c = connection;
                ch = channel;
                connection = null;
                channel = null;
                generation++;
            } finally {
                lock.writeLock().unlock();
            }
        }

        if (ch != null) {
            try {
                ch.close();
            } catch (IOException | TimeoutException | ShutdownSignalException e) {
                logger.atDebug()
                        .setCause(e)
                        .log("Error closing channel");
            }
        }
        if (c != null) {
            try {
                c.close(CLOSE_TIMEOUT_MILLIS);
            } catch (IOException | ShutdownSignalException e) {
                logger.atDebug()
                        .setCause(e)
                        .log("Error closing connection");
            }
        }

        for (Future<?> task : tasks) {
            try {
                task.get(CLOSE_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                logger.atWarn()
                        .setCause(e)
                        .log("Reconnect loop did not stop cleanly");
            }
        }
        executor.close();
        state = ConnectionState.CLOSED;
        logger.atInfo().log("Broker connection closed");
    }

    private static void abort(Connection c) {
        if (c != null) {
            c.abort(CLOSE_TIMEOUT_MILLIS);
        }
    }
}
