package com.p14n.amqpevent.consumer;

/**
 * Remembers the ids of successfully handled messages so that a redelivered
 * copy can be acknowledged without running its handler again.
 */
public interface Deduplicator {

    Deduplicator NONE = new Deduplicator() {
        @Override
        public boolean isDuplicate(String messageId) {
            return false;
        }

        @Override
        public void markProcessed(String messageId) {
        }
    };

    boolean isDuplicate(String messageId);

    void markProcessed(String messageId);
}
