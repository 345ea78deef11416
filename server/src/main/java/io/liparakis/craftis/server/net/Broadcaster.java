package io.liparakis.craftis.server.net;

import io.liparakis.craftis.protocol.MessageCodec;
import io.liparakis.craftis.protocol.ServerMessage;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fans server records out to every subscribed connection.
 * <p>
 * A record is encoded once and offered to each sink's bounded queue; a full
 * queue fails that sink alone and never delays the others. Records published
 * by one thread reach every sink in publication order.
 * </p>
 */
public final class Broadcaster {
    private static final Logger LOGGER = LoggerFactory.getLogger(Broadcaster.class);

    /**
     * Origin used for records no connection caused.
     */
    public static final long NO_ORIGIN = -1L;

    private final MessageCodec codec;
    private final Long2ObjectLinkedOpenHashMap<MessageSink> sinks = new Long2ObjectLinkedOpenHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Broadcaster(MessageCodec codec) {
        this.codec = codec;
    }

    public void subscribe(MessageSink sink) {
        lock.writeLock().lock();
        try {
            sinks.put(sink.connectionId(), sink);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return {@code true} if the connection was subscribed
     */
    public boolean unsubscribe(long connectionId) {
        lock.writeLock().lock();
        try {
            return sinks.remove(connectionId) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int subscriberCount() {
        lock.readLock().lock();
        try {
            return sinks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Publishes with the record's own echo policy.
     *
     * @see ServerMessage#suppressEcho()
     */
    public int publish(ServerMessage message, long originConnectionId) {
        return publish(message, originConnectionId, !message.suppressEcho());
    }

    /**
     * Offers a record to every subscriber.
     *
     * @param echoToOrigin whether the originating connection receives it too
     * @return number of sinks that accepted the record
     */
    public int publish(ServerMessage message, long originConnectionId, boolean echoToOrigin) {
        byte[] wire = codec.toWire(message);
        List<MessageSink> overflowed = null;
        int delivered = 0;

        lock.readLock().lock();
        try {
            for (MessageSink sink : sinks.values()) {
                if (!echoToOrigin && sink.connectionId() == originConnectionId) {
                    continue;
                }
                if (sink.offer(wire)) {
                    delivered++;
                } else {
                    if (overflowed == null) {
                        overflowed = new ArrayList<>();
                    }
                    overflowed.add(sink);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        if (overflowed != null) {
            for (MessageSink sink : overflowed) {
                LOGGER.warn("Outbound queue of connection {} is full - disconnecting it", sink.connectionId());
                sink.fail("outbound queue overflow");
            }
        }
        return delivered;
    }
}
