package io.liparakis.craftis.storage;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.liparakis.craftis.Craftis;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes {@code level.json} in a world directory.
 */
public final class LevelDataStore {
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    private final Path levelFile;

    public LevelDataStore(Path worldDir) {
        this.levelFile = worldDir.resolve(StorageConstants.LEVEL_FILE_NAME);
    }

    public Path path() {
        return levelFile;
    }

    /**
     * @return the stored level, or {@code null} for a new world
     * @throws StorageException if the file exists but cannot be parsed
     */
    public @Nullable LevelData read() throws IOException {
        if (!Files.exists(levelFile)) {
            return null;
        }
        try (Reader reader = Files.newBufferedReader(levelFile, StandardCharsets.UTF_8)) {
            LevelData data = GSON.fromJson(reader, LevelData.class);
            if (data == null) {
                throw new StorageException("Level file " + levelFile + " is empty");
            }
            return data;
        } catch (JsonParseException e) {
            throw new StorageException("Level file " + levelFile + " is malformed", e);
        }
    }

    /**
     * Writes the level file to a temporary sibling and renames it into place.
     */
    public void write(LevelData data) throws IOException {
        Files.createDirectories(levelFile.getParent());
        Path tempPath = levelFile.resolveSibling(levelFile.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            GSON.toJson(data, writer);
        }
        try {
            Files.move(tempPath, levelFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tempPath, levelFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Opens the level of an existing world, or creates it from
     * {@code proposed}.
     *
     * @return the effective level parameters
     * @throws IllegalStateException if the stored chunk size differs from the
     *                               proposed one; chunk records cannot be
     *                               reinterpreted under another size
     * @throws IOException           if the file cannot be read or written
     */
    public LevelData openOrCreate(LevelData proposed) throws IOException {
        LevelData stored = read();
        if (stored == null) {
            write(proposed);
            Craftis.LOGGER.info("Created new world at {} (generator={}, seed={})",
                    levelFile.getParent(), proposed.generator(), proposed.seed());
            return proposed;
        }

        if (stored.chunkSize() != proposed.chunkSize()) {
            throw new IllegalStateException("World at " + levelFile.getParent() + " uses chunk size "
                    + stored.chunkSize() + " but the server is configured for " + proposed.chunkSize());
        }
        if (stored.formatVersion() > StorageConstants.LEVEL_FORMAT_VERSION) {
            throw new IllegalStateException("Level file " + levelFile + " has unsupported format version "
                    + stored.formatVersion());
        }
        if (!stored.equals(proposed.withFormatVersion(stored.formatVersion()))) {
            Craftis.LOGGER.warn("Configured world parameters differ from {}; using the stored ones", levelFile);
        }
        Craftis.LOGGER.info("Opened world at {} (generator={}, seed={})",
                levelFile.getParent(), stored.generator(), stored.seed());
        return stored;
    }
}
