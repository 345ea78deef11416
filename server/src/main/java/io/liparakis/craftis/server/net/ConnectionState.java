package io.liparakis.craftis.server.net;

/**
 * Lifecycle of one client connection. Transitions only move forward.
 */
public enum ConnectionState {
    CONNECTED,
    HANDSHAKING,
    ACTIVE,
    CLOSING,
    CLOSED;

    boolean isBefore(ConnectionState other) {
        return ordinal() < other.ordinal();
    }
}
