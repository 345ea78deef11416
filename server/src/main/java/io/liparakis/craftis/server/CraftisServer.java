package io.liparakis.craftis.server;

import io.liparakis.craftis.player.PlayerRegistry;
import io.liparakis.craftis.player.Pose;
import io.liparakis.craftis.protocol.MessageCodec;
import io.liparakis.craftis.server.command.ChatCommands;
import io.liparakis.craftis.server.config.ServerConfig;
import io.liparakis.craftis.server.net.BlockFanout;
import io.liparakis.craftis.server.net.Broadcaster;
import io.liparakis.craftis.server.net.Listener;
import io.liparakis.craftis.server.net.ServerContext;
import io.liparakis.craftis.storage.ChunkStorage;
import io.liparakis.craftis.storage.LevelData;
import io.liparakis.craftis.storage.LevelDataStore;
import io.liparakis.craftis.storage.PersistenceEngine;
import io.liparakis.craftis.world.ChunkPos;
import io.liparakis.craftis.world.World;
import io.liparakis.craftis.world.WorldSettings;
import io.liparakis.craftis.world.gen.TerrainGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires world, storage and network together and owns their lifecycle.
 */
public final class CraftisServer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(CraftisServer.class);

    private final ServerConfig config;
    private final AtomicBoolean closed = new AtomicBoolean();

    private World world;
    private PlayerRegistry registry;
    private PersistenceEngine persistence;
    private Listener listener;
    private Thread acceptThread;

    public CraftisServer(ServerConfig config) {
        this.config = config;
    }

    /**
     * Opens the world and starts accepting clients.
     *
     * @throws IOException           if the world cannot be opened or the
     *                               endpoint cannot be bound
     * @throws IllegalStateException if the stored world is incompatible with
     *                               the configuration
     */
    public void start() throws IOException {
        LevelData level = new LevelDataStore(config.worldPath()).openOrCreate(config.levelData());
        WorldSettings settings = level.settings();
        TerrainGenerator generator = TerrainGenerator.byName(level.generator(), level.seed(), level.groundLevel());

        ChunkStorage storage = new ChunkStorage(config.worldPath());
        world = new World(settings, generator, storage);
        registry = new PlayerRegistry(config.spawnPose());

        MessageCodec codec = new MessageCodec();
        Broadcaster broadcaster = new Broadcaster(codec);
        world.addListener(new BlockFanout(broadcaster));

        persistence = new PersistenceEngine(world, storage, config.saveInterval(),
                config.flushDirtyThreshold(), config.chunkUnloadIdle());
        Pose spawn = config.spawnPose();
        persistence.start(ChunkPos.ofBlock((int) Math.floor(spawn.x()), (int) Math.floor(spawn.z()),
                settings.chunkSize()), config.preloadRadius());

        ServerContext context = new ServerContext(config, world, registry, broadcaster, codec,
                new ChatCommands(registry, settings));
        try {
            listener = new Listener(context);
        } catch (IOException e) {
            persistence.close();
            throw e;
        }

        acceptThread = new Thread(listener::acceptLoop, "craftis-accept");
        acceptThread.start();
        LOGGER.info("Craftis server started (generator={}, chunkSize={})", generator.name(), settings.chunkSize());
    }

    public int port() {
        return listener.port();
    }

    public World world() {
        return world;
    }

    public PlayerRegistry registry() {
        return registry;
    }

    public Listener listener() {
        return listener;
    }

    /**
     * Disconnects every client, then flushes and closes the world.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        LOGGER.info("Shutting down");
        if (listener != null) {
            listener.close();
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(1000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (persistence != null) {
            persistence.close();
        }
    }
}
