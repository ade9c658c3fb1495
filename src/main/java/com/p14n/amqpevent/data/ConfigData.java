package com.p14n.amqpevent.data;

import java.time.Duration;

public record ConfigData(String url,
        String exchange,
        String serviceName,
        String connectionName,
        Duration reconnectInitialDelay,
        Duration reconnectMaxDelay,
        Duration handlerTimeout,
        Duration connectionTimeout) implements BrokerConfig {

    public ConfigData {
        if (exchange == null || exchange.trim().isEmpty()) {
            throw new IllegalArgumentException("exchange cannot be null or empty");
        }
        if (serviceName == null || serviceName.trim().isEmpty()) {
            throw new IllegalArgumentException("serviceName cannot be null or empty");
        }
        if (connectionName == null) {
            connectionName = serviceName;
        }
        if (reconnectInitialDelay == null) {
            reconnectInitialDelay = Duration.ofSeconds(1);
        }
        if (reconnectMaxDelay == null) {
            reconnectMaxDelay = Duration.ofSeconds(30);
        }
        if (handlerTimeout == null) {
            handlerTimeout = Duration.ofSeconds(30);
        }
        if (connectionTimeout == null) {
            connectionTimeout = Duration.ofSeconds(10);
        }
        if (reconnectMaxDelay.compareTo(reconnectInitialDelay) < 0) {
            throw new IllegalArgumentException("reconnectMaxDelay must not be shorter than reconnectInitialDelay");
        }
    }

    public ConfigData(String url, String exchange, String serviceName) {
        this(url, exchange, serviceName, null, null, null, null, null);
    }

    public ConfigData withReconnectDelays(Duration initial, Duration max) {
        return new ConfigData(url, exchange, serviceName, connectionName, initial, max, handlerTimeout,
                connectionTimeout);
    }

    public ConfigData withHandlerTimeout(Duration timeout) {
        return new ConfigData(url, exchange, serviceName, connectionName, reconnectInitialDelay,
                reconnectMaxDelay, timeout, connectionTimeout);
    }
}
