package io.liparakis.craftis.world;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Source of previously persisted chunks.
 */
@FunctionalInterface
public interface ChunkLoader {

    /**
     * Loader for worlds without durable storage.
     */
    ChunkLoader NONE = pos -> null;

    /**
     * Loads a chunk from durable storage.
     *
     * @param pos the chunk position
     * @return the restored chunk, or {@code null} if nothing usable is stored
     * @throws IOException if storage could not be read; the chunk may still
     *                     exist and must not be replaced by a generated one
     */
    @Nullable
    Chunk load(ChunkPos pos) throws IOException;
}
