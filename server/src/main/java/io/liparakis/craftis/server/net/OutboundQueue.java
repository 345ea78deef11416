package io.liparakis.craftis.server.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Bounded per-connection send queue drained by a dedicated writer task.
 * <p>
 * Producers never wait: a full queue rejects the offer and the connection is
 * failed. The writer is the only thread touching the socket's output stream.
 * </p>
 */
final class OutboundQueue implements MessageSink, Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(OutboundQueue.class);
    private static final byte[] END_OF_STREAM = new byte[0];

    private final long connectionId;
    private final BlockingQueue<byte[]> queue;
    private final OutputStream out;
    private final Consumer<String> onFailure;

    private volatile boolean closed;

    /**
     * @param limit     queued records before the connection is failed
     * @param onFailure moves the connection to CLOSING; called with a reason
     */
    OutboundQueue(long connectionId, int limit, OutputStream out, Consumer<String> onFailure) {
        this.connectionId = connectionId;
        this.queue = new LinkedBlockingQueue<>(limit);
        this.out = out;
        this.onFailure = onFailure;
    }

    @Override
    public long connectionId() {
        return connectionId;
    }

    @Override
    public boolean offer(byte[] wire) {
        if (closed) {
            return false;
        }
        return queue.offer(wire);
    }

    @Override
    public void fail(String reason) {
        onFailure.accept(reason);
    }

    /**
     * Stops accepting records; the writer exits once it sees the end marker.
     * Records still queued are discarded.
     */
    void close() {
        closed = true;
        queue.clear();
        queue.offer(END_OF_STREAM);
    }

    int size() {
        return queue.size();
    }

    @Override
    public void run() {
        try {
            while (true) {
                byte[] wire = queue.take();
                if (wire == END_OF_STREAM) {
                    break;
                }
                out.write(wire);
                if (queue.isEmpty()) {
                    out.flush();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (!closed) {
                LOGGER.debug("Write to connection {} failed: {}", connectionId, e.getMessage());
                onFailure.accept("write failed");
            }
        }
    }
}
