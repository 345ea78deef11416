package io.liparakis.craftis.world;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Thrown when a chunk's stored data could not be read. Nothing is cached for
 * the chunk, so the next reference retries the load.
 */
public class ChunkLoadException extends UncheckedIOException {

    private final ChunkPos pos;

    public ChunkLoadException(ChunkPos pos, IOException cause) {
        super("Failed to load chunk " + pos, cause);
        this.pos = pos;
    }

    public ChunkPos pos() {
        return pos;
    }
}
