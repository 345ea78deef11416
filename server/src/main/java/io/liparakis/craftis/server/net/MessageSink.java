package io.liparakis.craftis.server.net;

/**
 * Receiving end of a broadcast: one per subscribed connection.
 */
public interface MessageSink {

    long connectionId();

    /**
     * Queues encoded wire bytes without blocking.
     *
     * @return {@code false} if the sink is full or closed; the bytes were
     *         dropped
     */
    boolean offer(byte[] wire);

    /**
     * Moves the owning connection to CLOSING. Must not block.
     */
    void fail(String reason);
}
