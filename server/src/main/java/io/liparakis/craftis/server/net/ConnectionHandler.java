package io.liparakis.craftis.server.net;

import io.liparakis.craftis.Craftis;
import io.liparakis.craftis.player.NameTakenException;
import io.liparakis.craftis.player.Player;
import io.liparakis.craftis.player.Pose;
import io.liparakis.craftis.player.StaleReferenceException;
import io.liparakis.craftis.protocol.ClientMessage;
import io.liparakis.craftis.protocol.LineDecoder;
import io.liparakis.craftis.protocol.MessageCodec;
import io.liparakis.craftis.protocol.ProtocolException;
import io.liparakis.craftis.protocol.ServerMessage;
import io.liparakis.craftis.server.command.ChatCommands;
import io.liparakis.craftis.server.command.CommandSource;
import io.liparakis.craftis.world.BlockEntry;
import io.liparakis.craftis.world.BlockOutOfRangeException;
import io.liparakis.craftis.world.ChunkLoadException;
import io.liparakis.craftis.world.ChunkPos;
import io.liparakis.craftis.world.ChunkSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves one client socket from accept to close.
 * <p>
 * The handler's own thread reads and dispatches records; a separate writer
 * task drains the outbound queue, so a slow peer only ever stalls itself.
 * Any failure (read error, protocol violation, idle timeout, queue overflow,
 * explicit {@code D}) moves the connection to CLOSING, and cleanup runs
 * exactly once.
 * </p>
 */
public final class ConnectionHandler implements Runnable, ClientMessage.Visitor, CommandSource {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionHandler.class);
    private static final int READ_BUFFER_SIZE = 4096;
    private static final int NO_PLAYER = -1;

    private final long connectionId;
    private final Socket socket;
    private final ServerContext context;
    private final Executor writerExecutor;
    private final LineDecoder decoder;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTED);
    private final AtomicBoolean cleanedUp = new AtomicBoolean();

    private OutboundQueue outbound;
    private volatile int playerId = NO_PLAYER;
    private volatile String closeReason = "connection closed";

    public ConnectionHandler(long connectionId, Socket socket, ServerContext context, Executor writerExecutor) {
        this.connectionId = connectionId;
        this.socket = socket;
        this.context = context;
        this.writerExecutor = writerExecutor;
        this.decoder = new LineDecoder(context.config().maxLineLength());
    }

    public long connectionId() {
        return connectionId;
    }

    public ConnectionState state() {
        return state.get();
    }

    @Override
    public void run() {
        try {
            socket.setSoTimeout((int) context.config().idleTimeout().toMillis());
            socket.setTcpNoDelay(true);
            outbound = new OutboundQueue(connectionId, context.config().outboundQueueLimit(),
                    new BufferedOutputStream(socket.getOutputStream()), this::fail);
            writerExecutor.execute(outbound);

            handshake();
            readLoop();
        } catch (ProtocolException e) {
            closeReason = "protocol error";
            LOGGER.warn("Protocol error on connection {}: {}", connectionId, e.getMessage());
        } catch (ConnectionFaultException e) {
            closeReason = e.getMessage();
            LOGGER.info("Connection {} faulted: {}", connectionId, e.getMessage());
        } catch (IOException e) {
            if (state.get() == ConnectionState.ACTIVE) {
                closeReason = "read failed";
            }
            LOGGER.debug("Connection {} I/O ended: {}", connectionId, e.getMessage());
        } catch (RuntimeException e) {
            closeReason = "internal error";
            LOGGER.error("Unexpected failure serving connection {}", connectionId, e);
        } finally {
            cleanup();
        }
    }

    // ==================== Handshake ====================

    private void handshake() throws ConnectionFaultException {
        if (!state.compareAndSet(ConnectionState.CONNECTED, ConnectionState.HANDSHAKING)) {
            throw new ConnectionFaultException("closed before handshake");
        }

        Player player = context.registry().register(connectionId, null);
        playerId = player.id();
        LOGGER.info("Connection {} from {} joined as {} (id {})",
                connectionId, socket.getRemoteSocketAddress(), player.name(), player.id());

        send(new ServerMessage.You(player.id(), player.pose()));
        send(new ServerMessage.Time(System.currentTimeMillis() / 1000L, context.config().dayLength()));
        send(new ServerMessage.Talk(context.config().motd()));

        // Subscribe before listing, so a player joining concurrently is seen
        // through one path or the other.
        context.broadcaster().subscribe(outbound);
        context.registry().list()
                .filter(other -> other.id() != player.id())
                .forEach(other -> {
                    send(new ServerMessage.PlayerName(other.id(), other.name()));
                    send(new ServerMessage.PlayerPosition(other.id(), other.pose()));
                });

        Broadcaster broadcaster = context.broadcaster();
        broadcaster.publish(new ServerMessage.PlayerName(player.id(), player.name()), connectionId, false);
        broadcaster.publish(new ServerMessage.PlayerPosition(player.id(), player.pose()), connectionId, false);
        broadcaster.publish(new ServerMessage.Talk(player.name() + " joined the game"), connectionId, false);

        if (!state.compareAndSet(ConnectionState.HANDSHAKING, ConnectionState.ACTIVE)) {
            throw new ConnectionFaultException(closeReason);
        }
    }

    // ==================== Read Loop ====================

    private void readLoop() throws IOException {
        InputStream in = socket.getInputStream();
        byte[] buffer = new byte[READ_BUFFER_SIZE];
        MessageCodec codec = context.codec();

        while (state.get() == ConnectionState.ACTIVE) {
            int read;
            try {
                read = in.read(buffer);
            } catch (SocketTimeoutException e) {
                throw new ConnectionFaultException("idle for " + context.config().idleTimeout().toSeconds() + "s", e);
            }
            if (read < 0) {
                closeReason = "peer closed the connection";
                return;
            }

            decoder.feed(buffer, 0, read);
            String record;
            while (state.get() == ConnectionState.ACTIVE && (record = decoder.next()) != null) {
                if (record.isEmpty()) {
                    continue;
                }
                codec.decodeClient(record).accept(this);
            }
        }
    }

    // ==================== Dispatch ====================

    @Override
    public void visitVersion(ClientMessage.Version message) throws ProtocolException {
        if (message.version() != Craftis.PROTOCOL_VERSION) {
            throw new ProtocolException("V," + message.version(),
                    "Unsupported protocol version, expected " + Craftis.PROTOCOL_VERSION);
        }
    }

    @Override
    public void visitAuthenticate(ClientMessage.Authenticate message) {
        rename(message.username());
    }

    @Override
    public void visitNick(ClientMessage.Nick message) {
        rename(message.name());
    }

    @Override
    public void visitChunkRequest(ClientMessage.ChunkRequest message) {
        ChunkPos pos = new ChunkPos(message.p(), message.q());
        try {
            context.world().streamChunk(pos, snapshot -> sendChunk(snapshot, message.key()));
        } catch (ChunkLoadException e) {
            // The client asks again when it next needs the chunk.
            LOGGER.warn("Dropped chunk request {} from connection {}", pos, connectionId, e);
        }
    }

    /**
     * Queues the whole chunk response as one batch; runs under the chunk lock.
     */
    private void sendChunk(ChunkSnapshot snapshot, int knownRevision) {
        MessageCodec codec = context.codec();
        ChunkPos pos = snapshot.pos();
        int size = snapshot.chunkSize();
        ByteArrayOutputStream batch = new ByteArrayOutputStream();

        for (BlockEntry entry : snapshot.entriesSince(knownRevision)) {
            appendRecord(batch, codec.encode(new ServerMessage.BlockUpdate(pos.p(), pos.q(),
                    pos.blockX(entry.x(), size), entry.y(), pos.blockZ(entry.z(), size), entry.material())));
        }
        appendRecord(batch, codec.encode(new ServerMessage.ChunkKey(pos.p(), pos.q(), snapshot.revision())));
        appendRecord(batch, codec.encode(new ServerMessage.Redraw(pos.p(), pos.q())));
        offerOrFail(batch.toByteArray());
    }

    private static void appendRecord(ByteArrayOutputStream batch, String record) {
        byte[] bytes = record.getBytes(StandardCharsets.UTF_8);
        batch.write(bytes, 0, bytes.length);
        batch.write(MessageCodec.TERMINATOR);
    }

    @Override
    public void visitBlockEdit(ClientMessage.BlockEdit message) {
        try {
            context.world().setBlock(message.x(), message.y(), message.z(), message.material());
        } catch (BlockOutOfRangeException e) {
            LOGGER.debug("Rejected edit from connection {}: {}", connectionId, e.getMessage());
        } catch (ChunkLoadException e) {
            LOGGER.warn("Dropped edit from connection {}: chunk {} is unreadable", connectionId, e.pos(), e);
        }
    }

    @Override
    public void visitPosition(ClientMessage.Position message) {
        try {
            context.registry().updateTransform(playerId, message.pose());
        } catch (StaleReferenceException e) {
            LOGGER.debug("Position update for departed player {}", e.playerId());
            return;
        }
        context.broadcaster().publish(new ServerMessage.PlayerPosition(playerId, message.pose()), connectionId);
    }

    @Override
    public void visitTalk(ClientMessage.Talk message) {
        String text = message.text();
        if (ChatCommands.isCommand(text)) {
            try {
                context.commands().execute(this, text);
            } catch (StaleReferenceException e) {
                LOGGER.debug("Command from departed player {}", e.playerId());
            }
            return;
        }
        Player player = context.registry().get(playerId);
        if (player != null) {
            context.broadcaster().publish(new ServerMessage.Talk(player.name() + "> " + text), connectionId);
        }
    }

    @Override
    public void visitDisconnect(ClientMessage.Disconnect message) {
        closeReason = "client disconnected";
        state.compareAndSet(ConnectionState.ACTIVE, ConnectionState.CLOSING);
    }

    // ==================== Command Source ====================

    @Override
    public Player player() {
        Player player = context.registry().get(playerId);
        if (player == null) {
            throw new StaleReferenceException(playerId);
        }
        return player;
    }

    @Override
    public void reply(String text) {
        send(new ServerMessage.Talk(text));
    }

    @Override
    public void teleport(Pose pose) {
        context.registry().updateTransform(playerId, pose);
        send(new ServerMessage.You(playerId, pose));
        context.broadcaster().publish(new ServerMessage.PlayerPosition(playerId, pose), connectionId, false);
    }

    @Override
    public void rename(String name) {
        Player before;
        try {
            before = player();
            context.registry().rename(playerId, name);
        } catch (StaleReferenceException e) {
            LOGGER.debug("Rename of departed player {}", e.playerId());
            return;
        } catch (NameTakenException e) {
            reply(e.getMessage());
            return;
        }
        Broadcaster broadcaster = context.broadcaster();
        broadcaster.publish(new ServerMessage.PlayerName(playerId, name), connectionId, true);
        if (!before.name().equals(name)) {
            broadcaster.publish(new ServerMessage.Talk(before.name() + " is now known as " + name), connectionId, true);
        }
    }

    // ==================== Output ====================

    private void send(ServerMessage message) {
        offerOrFail(context.codec().toWire(message));
    }

    private void offerOrFail(byte[] wire) {
        if (!outbound.offer(wire)) {
            fail("outbound queue overflow");
        }
    }

    /**
     * Moves the connection to CLOSING and closes the socket, which unblocks
     * the reader. Safe to call from any thread, any number of times.
     */
    public void fail(String reason) {
        ConnectionState current = state.get();
        while (current.isBefore(ConnectionState.CLOSING)) {
            if (state.compareAndSet(current, ConnectionState.CLOSING)) {
                closeReason = reason;
                LOGGER.debug("Closing connection {}: {}", connectionId, reason);
                closeSocket();
                return;
            }
            current = state.get();
        }
    }

    // ==================== Cleanup ====================

    private void cleanup() {
        if (!cleanedUp.compareAndSet(false, true)) {
            return;
        }
        state.set(ConnectionState.CLOSING);

        Broadcaster broadcaster = context.broadcaster();
        broadcaster.unsubscribe(connectionId);
        if (outbound != null) {
            outbound.close();
        }

        int id = playerId;
        if (id != NO_PLAYER) {
            try {
                // Unregister before announcing, so a newcomer either lists
                // this player and later sees the D, or never sees it at all.
                Player departed = context.registry().unregister(id);
                broadcaster.publish(new ServerMessage.PlayerLeft(id), connectionId, false);
                broadcaster.publish(new ServerMessage.Talk(departed.name() + " left the game"), connectionId, false);
                context.registry().reclaim(id);
                LOGGER.info("{} (id {}) left: {}", departed.name(), id, closeReason);
            } catch (StaleReferenceException e) {
                LOGGER.debug("Player {} was already removed", e.playerId());
            }
        }

        closeSocket();
        state.set(ConnectionState.CLOSED);
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing connection {}: {}", connectionId, e.getMessage());
        }
    }
}
