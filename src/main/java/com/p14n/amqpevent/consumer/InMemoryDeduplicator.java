package com.p14n.amqpevent.consumer;

import java.time.Duration;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * Bounded, time-limited record of processed message ids held in memory.
 * Ids are forgotten after {@code retention} or when more than
 * {@code maximumSize} ids are held, whichever comes first. Messages without
 * an id are never treated as duplicates.
 */
public class InMemoryDeduplicator implements Deduplicator {

    private final Cache<String, Boolean> processed;

    public InMemoryDeduplicator(long maximumSize, Duration retention) {
        this.processed = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(retention)
                .build();
    }

    @Override
    public boolean isDuplicate(String messageId) {
        return messageId != null && processed.getIfPresent(messageId) != null;
    }

    @Override
    public void markProcessed(String messageId) {
        if (messageId != null) {
            processed.put(messageId, Boolean.TRUE);
        }
    }

    long size() {
        processed.cleanUp();
        return processed.size();
    }
}
