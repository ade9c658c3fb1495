package com.p14n.amqpevent.broker;

import java.io.IOException;

import com.rabbitmq.client.Channel;

/**
 * Declares broker-side resources on a freshly created channel, before the
 * channel is made visible to publishers and listeners.
 */
@FunctionalInterface
public interface ChannelInitializer {

    void initialize(Channel channel) throws IOException;
}
