package com.p14n.amqpevent.broker;

/**
 * Lifecycle states of a {@link ConnectionManager}.
 *
 * <p>
 * {@code DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED -> ...}
 * repeats for as long as the manager is open. {@code CLOSING} and
 * {@code CLOSED} are only entered through {@link ConnectionManager#close()}.
 * </p>
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING,
    CLOSED
}
