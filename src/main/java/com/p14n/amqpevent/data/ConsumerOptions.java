package com.p14n.amqpevent.data;

import java.util.HashMap;
import java.util.Map;

import com.p14n.amqpevent.consumer.Deduplicator;
import com.p14n.amqpevent.consumer.RedeliveryPolicy;

/**
 * Queue, prefetch and redelivery settings of an event consumer.
 *
 * <p>
 * {@link #defaults(String)} gives a durable, shared, non-auto-deleted queue
 * with a prefetch of one message, unlimited requeue on handler failure and no
 * duplicate suppression.
 * </p>
 *
 * @param queueName          the queue this consumer declares and binds
 * @param durable            whether the queue survives broker restarts
 * @param autoDelete         whether the broker deletes the queue after the last
 *                           consumer leaves
 * @param exclusive          whether the queue is private to one connection
 * @param queueArguments     extra {@code x-} arguments for the queue
 *                           declaration
 * @param prefetchCount      maximum number of unacknowledged messages in flight
 * @param prefetchSize       maximum unacknowledged bytes, 0 for no limit
 * @param prefetchGlobal     apply the prefetch limits to the whole channel
 * @param deadLetterExchange exchange rejected messages are routed to, or null
 * @param redeliveryPolicy   decides whether a failed delivery is requeued
 * @param deduplicator       suppresses already processed message ids
 */
public record ConsumerOptions(String queueName,
        boolean durable,
        boolean autoDelete,
        boolean exclusive,
        Map<String, Object> queueArguments,
        int prefetchCount,
        int prefetchSize,
        boolean prefetchGlobal,
        String deadLetterExchange,
        RedeliveryPolicy redeliveryPolicy,
        Deduplicator deduplicator) {

    public static final String DEAD_LETTER_EXCHANGE_ARGUMENT = "x-dead-letter-exchange";

    public ConsumerOptions {
        if (queueName == null || queueName.trim().isEmpty()) {
            throw new IllegalArgumentException("queueName cannot be null or empty");
        }
        if (prefetchCount < 0 || prefetchSize < 0) {
            throw new IllegalArgumentException("prefetch limits cannot be negative");
        }
        queueArguments = queueArguments == null ? Map.of() : Map.copyOf(queueArguments);
        if (redeliveryPolicy == null) {
            redeliveryPolicy = RedeliveryPolicy.UNLIMITED;
        }
        if (deduplicator == null) {
            deduplicator = Deduplicator.NONE;
        }
    }

    public static ConsumerOptions defaults(String queueName) {
        return new ConsumerOptions(queueName, true, false, false, Map.of(), 1, 0, false, null, null, null);
    }

    /**
     * Returns the arguments for the queue declaration, including the dead-letter
     * exchange when one is configured.
     */
    public Map<String, Object> declareArguments() {
        Map<String, Object> args = new HashMap<>(queueArguments);
        if (deadLetterExchange != null && !deadLetterExchange.isBlank()) {
            args.put(DEAD_LETTER_EXCHANGE_ARGUMENT, deadLetterExchange);
        }
        return args;
    }

    public ConsumerOptions withPrefetchCount(int prefetchCount) {
        return new ConsumerOptions(queueName, durable, autoDelete, exclusive, queueArguments, prefetchCount,
                prefetchSize, prefetchGlobal, deadLetterExchange, redeliveryPolicy, deduplicator);
    }

    public ConsumerOptions withQueueArguments(Map<String, Object> queueArguments) {
        return new ConsumerOptions(queueName, durable, autoDelete, exclusive, queueArguments, prefetchCount,
                prefetchSize, prefetchGlobal, deadLetterExchange, redeliveryPolicy, deduplicator);
    }

    public ConsumerOptions withDeadLetterExchange(String deadLetterExchange) {
        return new ConsumerOptions(queueName, durable, autoDelete, exclusive, queueArguments, prefetchCount,
                prefetchSize, prefetchGlobal, deadLetterExchange, redeliveryPolicy, deduplicator);
    }

    public ConsumerOptions withRedeliveryPolicy(RedeliveryPolicy redeliveryPolicy) {
        return new ConsumerOptions(queueName, durable, autoDelete, exclusive, queueArguments, prefetchCount,
                prefetchSize, prefetchGlobal, deadLetterExchange, redeliveryPolicy, deduplicator);
    }

    public ConsumerOptions withDeduplicator(Deduplicator deduplicator) {
        return new ConsumerOptions(queueName, durable, autoDelete, exclusive, queueArguments, prefetchCount,
                prefetchSize, prefetchGlobal, deadLetterExchange, redeliveryPolicy, deduplicator);
    }
}
