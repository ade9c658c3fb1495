package com.p14n.amqpevent.consumer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.p14n.amqpevent.EventHandler;

/**
 * Routing keys (or binding patterns) and the handler registered for each.
 *
 * <p>
 * A delivery is resolved to the handler registered under its exact routing
 * key first; otherwise the first wildcard pattern, in registration order,
 * that matches it wins.
 * </p>
 */
public class SubscriptionRegistry {

    private record Entry(TopicPattern pattern, EventHandler handler) {
    }

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    /**
     * Registers or replaces the handler for a key. A replaced handler keeps its
     * position in the resolution order.
     *
     * @return true if the key was not registered before
     */
    public synchronized boolean register(String key, EventHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        TopicPattern pattern = TopicPattern.of(key);
        return entries.put(key, new Entry(pattern, handler)) == null;
    }

    public synchronized boolean remove(String key) {
        return entries.remove(key) != null;
    }

    public synchronized EventHandler resolve(String routingKey) {
        Entry exact = entries.get(routingKey);
        if (exact != null) {
            return exact.handler();
        }
        for (Entry entry : entries.values()) {
            if (entry.pattern().isWildcard() && entry.pattern().matches(routingKey)) {
                return entry.handler();
            }
        }
        return null;
    }

    public synchronized List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized int size() {
        return entries.size();
    }
}
