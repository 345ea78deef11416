package io.liparakis.craftis.world;

import org.jetbrains.annotations.NotNull;

/**
 * Chunk coordinates. {@code p} runs along the world X axis and {@code q}
 * along Z, matching the Craft wire protocol.
 *
 * @param p the chunk X coordinate
 * @param q the chunk Z coordinate
 */
public record ChunkPos(int p, int q) {

    /**
     * Resolves the chunk owning a block column.
     *
     * @param x         block X coordinate
     * @param z         block Z coordinate
     * @param chunkSize side length of a chunk in blocks
     * @return the owning chunk position
     */
    public static ChunkPos ofBlock(int x, int z, int chunkSize) {
        return new ChunkPos(Math.floorDiv(x, chunkSize), Math.floorDiv(z, chunkSize));
    }

    /**
     * World X coordinate of a local column offset inside this chunk.
     */
    public int blockX(int localX, int chunkSize) {
        return p * chunkSize + localX;
    }

    /**
     * World Z coordinate of a local column offset inside this chunk.
     */
    public int blockZ(int localZ, int chunkSize) {
        return q * chunkSize + localZ;
    }

    /**
     * Chebyshev distance between two chunk positions.
     */
    public int distance(ChunkPos other) {
        return Math.max(Math.abs(p - other.p), Math.abs(q - other.q));
    }

    @Override
    public @NotNull String toString() {
        return "(" + p + ", " + q + ")";
    }
}
