package com.p14n.amqpevent.consumer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * Counts deliveries per message id for queues that do not report an
 * {@code x-delivery-count} header. Counts survive reconnects but not restarts;
 * a message first seen already redelivered is counted as delivered once
 * before.
 */
public class DeliveryAttempts {

    private final Cache<String, AtomicInteger> attempts;

    public DeliveryAttempts(long maximumSize, Duration retention) {
        this.attempts = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterAccess(retention)
                .build();
    }

    /**
     * Records a delivery of {@code messageId}.
     *
     * @return the number of earlier deliveries of the message
     */
    public long recordAttempt(String messageId, boolean redelivered) {
        if (messageId == null) {
            return redelivered ? 1 : 0;
        }
        AtomicInteger count = attempts.asMap().computeIfAbsent(messageId, id -> new AtomicInteger());
        synchronized (count) {
            if (!redelivered) {
                count.set(1);
                return 0;
            }
            int earlier = Math.max(count.get(), 1);
            count.set(earlier + 1);
            return earlier;
        }
    }

    /**
     * Drops the count of a message that has been settled for good.
     */
    public void forget(String messageId) {
        if (messageId != null) {
            attempts.invalidate(messageId);
        }
    }
}
