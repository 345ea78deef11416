package io.liparakis.craftis.server.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.liparakis.craftis.player.Pose;
import io.liparakis.craftis.protocol.LineDecoder;
import io.liparakis.craftis.storage.LevelData;
import io.liparakis.craftis.world.WorldSettings;
import io.liparakis.craftis.world.gen.TerrainGenerator;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Server configuration, read from a JSON file. Every field has a default, so
 * a missing file or a file naming only some fields is valid.
 */
public final class ServerConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(ServerConfig.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static final int DEFAULT_PORT = 4080;

    private String host = "0.0.0.0";
    private int port = DEFAULT_PORT;
    private String worldDir = "world";

    private int chunkSize = WorldSettings.DEFAULT_CHUNK_SIZE;
    private int minY = WorldSettings.DEFAULT_MIN_Y;
    private int maxY = WorldSettings.DEFAULT_MAX_Y;
    private int maxMaterialId = WorldSettings.DEFAULT_MAX_MATERIAL_ID;
    private String generator = "void";
    private long seed = 0L;
    private int groundLevel = 12;
    private Spawn spawn = new Spawn();

    private int idleTimeoutSeconds = 300;
    private int outboundQueueLimit = 1024;
    private int maxLineLength = LineDecoder.DEFAULT_MAX_RECORD_LENGTH;

    private int saveIntervalSeconds = 30;
    private int flushDirtyThreshold = 256;
    private int preloadRadius = 2;
    private int chunkUnloadIdleSeconds = 0;

    private int dayLength = 600;
    private String motd = "Welcome to Craft!";

    /**
     * Loads a configuration file, or the defaults if {@code path} is
     * {@code null} or names a file that does not exist.
     *
     * @throws IOException              if the file cannot be read or parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ServerConfig load(@Nullable Path path) throws IOException {
        ServerConfig config;
        if (path == null || !Files.exists(path)) {
            if (path != null) {
                LOGGER.info("No configuration at {} - using defaults", path);
            }
            config = new ServerConfig();
        } else {
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                config = GSON.fromJson(reader, ServerConfig.class);
            } catch (JsonParseException e) {
                throw new IOException("Malformed configuration " + path + ": " + e.getMessage(), e);
            }
            if (config == null) {
                config = new ServerConfig();
            }
            LOGGER.info("Loaded configuration from {}", path);
        }
        config.validate();
        return config;
    }

    public static ServerConfig defaults() {
        return new ServerConfig();
    }

    /**
     * @throws IllegalArgumentException naming the first invalid value
     */
    public void validate() {
        require(host != null && !host.isBlank(), "host must not be empty");
        require(port >= 0 && port <= 65535, "port out of range: " + port);
        require(worldDir != null && !worldDir.isBlank(), "worldDir must not be empty");
        // Throws for bad geometry.
        worldSettings();
        require(generator != null, "generator must be set");
        TerrainGenerator.byName(generator, seed, groundLevel);
        require(spawn != null, "spawn must be set");
        spawn.toPose();
        require(idleTimeoutSeconds >= 0, "idleTimeoutSeconds must not be negative: " + idleTimeoutSeconds);
        require(outboundQueueLimit >= 1, "outboundQueueLimit must be positive: " + outboundQueueLimit);
        require(maxLineLength >= 64, "maxLineLength must be at least 64: " + maxLineLength);
        require(saveIntervalSeconds >= 1, "saveIntervalSeconds must be positive: " + saveIntervalSeconds);
        require(flushDirtyThreshold >= 1, "flushDirtyThreshold must be positive: " + flushDirtyThreshold);
        require(preloadRadius >= 0, "preloadRadius must not be negative: " + preloadRadius);
        require(chunkUnloadIdleSeconds >= 0, "chunkUnloadIdleSeconds must not be negative: " + chunkUnloadIdleSeconds);
        require(dayLength >= 1, "dayLength must be positive: " + dayLength);
        require(motd != null, "motd must be set");
    }

    private static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid configuration: " + message);
        }
    }

    // ==================== Derived Views ====================

    public WorldSettings worldSettings() {
        return new WorldSettings(chunkSize, minY, maxY, maxMaterialId);
    }

    /**
     * Level parameters for a world created from this configuration.
     */
    public LevelData levelData() {
        return LevelData.of(worldSettings(), generator, seed, groundLevel);
    }

    public Path worldPath() {
        return Paths.get(worldDir);
    }

    public Pose spawnPose() {
        return spawn.toPose();
    }

    /**
     * @return the read timeout, or {@link Duration#ZERO} for none
     */
    public Duration idleTimeout() {
        return Duration.ofSeconds(idleTimeoutSeconds);
    }

    public Duration saveInterval() {
        return Duration.ofSeconds(saveIntervalSeconds);
    }

    /**
     * @return idle time before clean chunks are evicted, or {@code null} when
     *         eviction is disabled
     */
    public @Nullable Duration chunkUnloadIdle() {
        return chunkUnloadIdleSeconds == 0 ? null : Duration.ofSeconds(chunkUnloadIdleSeconds);
    }

    // ==================== Accessors ====================

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public int outboundQueueLimit() {
        return outboundQueueLimit;
    }

    public int maxLineLength() {
        return maxLineLength;
    }

    public int flushDirtyThreshold() {
        return flushDirtyThreshold;
    }

    public int preloadRadius() {
        return preloadRadius;
    }

    public int dayLength() {
        return dayLength;
    }

    public String motd() {
        return motd;
    }

    // ==================== Builder-style Overrides ====================

    public ServerConfig withPort(int port) {
        this.port = port;
        return this;
    }

    public ServerConfig withHost(String host) {
        this.host = host;
        return this;
    }

    public ServerConfig withWorldDir(Path worldDir) {
        this.worldDir = worldDir.toString();
        return this;
    }

    public ServerConfig withGenerator(String generator) {
        this.generator = generator;
        return this;
    }

    public ServerConfig withIdleTimeoutSeconds(int seconds) {
        this.idleTimeoutSeconds = seconds;
        return this;
    }

    public ServerConfig withOutboundQueueLimit(int limit) {
        this.outboundQueueLimit = limit;
        return this;
    }

    public ServerConfig withPreloadRadius(int radius) {
        this.preloadRadius = radius;
        return this;
    }

    public ServerConfig withSaveIntervalSeconds(int seconds) {
        this.saveIntervalSeconds = seconds;
        return this;
    }

    public ServerConfig withChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
        return this;
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    /**
     * Spawn pose as it appears in the configuration file.
     */
    static final class Spawn {
        float x;
        float y;
        float z;
        float rx;
        float ry;

        Pose toPose() {
            return new Pose(x, y, z, rx, ry);
        }
    }
}
