package com.p14n.amqpevent.broker;

import java.io.IOException;

import com.rabbitmq.client.Channel;

/**
 * Listens for connection lifecycle changes of a {@link ConnectionManager}.
 */
public interface ConnectionListener {

    /**
     * Called after every successful connect or reconnect with the fresh channel.
     * Throwing tears the new connection down again; the reconnect loop then
     * retries with backoff.
     *
     * @param channel the channel of the new connection
     * @throws IOException if the listener cannot set up its broker resources
     */
    void onConnected(Channel channel) throws IOException;

    /**
     * Called once the live connection has been lost unexpectedly.
     */
    default void onDisconnected() {
    }
}
