package com.p14n.amqpevent.consumer;

/**
 * An AMQP topic binding key. Words are separated by dots; {@code *} matches
 * exactly one word and {@code #} matches zero or more words.
 */
public final class TopicPattern {

    private final String key;
    private final String[] words;
    private final boolean wildcard;

    private TopicPattern(String key) {
        this.key = key;
        this.words = key.split("\\.", -1);
        this.wildcard = key.contains("*") || key.contains("#");
    }

    public static TopicPattern of(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Routing key cannot be null or empty");
        }
        return new TopicPattern(key);
    }

    public String key() {
        return key;
    }

    public boolean isWildcard() {
        return wildcard;
    }

    public boolean matches(String routingKey) {
        if (routingKey == null) {
            return false;
        }
        if (!wildcard) {
            return key.equals(routingKey);
        }
        return match(words, 0, routingKey.split("\\.", -1), 0);
    }

    private static boolean match(String[] pattern, int p, String[] topic, int t) {
        if (p == pattern.length) {
            return t == topic.length;
        }
        String word = pattern[p];
        if ("#".equals(word)) {
            for (int i = t; i <= topic.length; i++) {
                if (match(pattern, p + 1, topic, i)) {
                    return true;
                }
            }
            return false;
        }
        if (t == topic.length) {
            return false;
        }
        if ("*".equals(word) || word.equals(topic[t])) {
            return match(pattern, p + 1, topic, t + 1);
        }
        return false;
    }

    @Override
    public String toString() {
        return key;
    }
}
