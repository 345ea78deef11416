package io.liparakis.craftis.server.net;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepts client sockets and hands each to its own {@link ConnectionHandler}.
 */
public final class Listener implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Listener.class);
    private static final int BACKLOG = 64;
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final ServerContext context;
    private final ServerSocket serverSocket;
    private final ExecutorService pool = Executors.newCachedThreadPool(new NamedThreadFactory("craftis-connection"));
    private final AtomicLong connectionIds = new AtomicLong();
    private final Set<ConnectionHandler> handlers = ConcurrentHashMap.newKeySet();

    private volatile boolean closed;

    /**
     * Binds the configured endpoint.
     *
     * @throws IOException if the address cannot be bound
     */
    public Listener(ServerContext context) throws IOException {
        this.context = context;
        this.serverSocket = new ServerSocket();
        try {
            serverSocket.setReuseAddress(true);
            serverSocket.bind(new InetSocketAddress(context.config().host(), context.config().port()), BACKLOG);
        } catch (IOException e) {
            serverSocket.close();
            throw e;
        }
        LOGGER.info("Listening on {}:{}", context.config().host(), port());
    }

    /**
     * @return the bound port, useful when configured with port 0
     */
    public int port() {
        return serverSocket.getLocalPort();
    }

    public int connectionCount() {
        return handlers.size();
    }

    /**
     * Accepts until {@link #close()} is called.
     */
    public void acceptLoop() {
        while (!closed) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (closed) {
                    return;
                }
                LOGGER.warn("Accept failed: {}", e.getMessage());
                continue;
            } catch (IOException e) {
                LOGGER.warn("Accept failed: {}", e.getMessage());
                continue;
            }

            ConnectionHandler handler = new ConnectionHandler(connectionIds.incrementAndGet(), socket, context, pool);
            handlers.add(handler);
            try {
                pool.execute(() -> {
                    try {
                        handler.run();
                    } finally {
                        handlers.remove(handler);
                    }
                });
            } catch (RejectedExecutionException e) {
                handlers.remove(handler);
                closeQuietly(socket);
            }
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing rejected socket: {}", e.getMessage());
        }
    }

    /**
     * Stops accepting and closes every open connection.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            serverSocket.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close listening socket", e);
        }
        for (ConnectionHandler handler : handlers) {
            handler.fail("server shutting down");
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Daemon threads named {@code prefix-N}.
     */
    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
