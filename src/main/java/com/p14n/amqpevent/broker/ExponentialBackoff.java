package com.p14n.amqpevent.broker;

import java.time.Duration;

/**
 * Doubling delay sequence with an upper bound. Not thread safe; each reconnect
 * loop owns its own instance.
 */
public class ExponentialBackoff {

    private final Duration max;
    private Duration current;

    public ExponentialBackoff(Duration initial, Duration max) {
        if (initial.isNegative() || initial.isZero()) {
            throw new IllegalArgumentException("initial delay must be positive");
        }
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("max delay must not be shorter than the initial delay");
        }
        this.max = max;
        this.current = initial;
    }

    /**
     * Returns the delay to wait before the next attempt and advances the
     * sequence.
     *
     * @return the next delay
     */
    public Duration next() {
        Duration delay = current;
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(max) > 0 ? max : doubled;
        return delay;
    }
}
