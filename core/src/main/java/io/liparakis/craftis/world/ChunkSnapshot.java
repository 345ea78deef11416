package io.liparakis.craftis.world;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable point-in-time copy of a chunk's contents.
 * <p>
 * Entries are ordered by packed position key, so two snapshots of chunks with
 * the same contents and revision are {@linkplain #equals(Object) equal}
 * regardless of the order in which the blocks were written.
 * </p>
 */
public final class ChunkSnapshot {
    private final ChunkPos pos;
    private final int chunkSize;
    private final int revision;
    private final int[] keys;
    private final long[] values;

    ChunkSnapshot(ChunkPos pos, int chunkSize, int revision, int[] keys, long[] values) {
        this.pos = pos;
        this.chunkSize = chunkSize;
        this.revision = revision;
        this.keys = keys;
        this.values = values;
    }

    public ChunkPos pos() {
        return pos;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int revision() {
        return revision;
    }

    /**
     * @return number of stored entries, air tombstones included
     */
    public int entryCount() {
        return keys.length;
    }

    /**
     * Looks up a block by world coordinates.
     *
     * @return the stored material, or air when the position holds no entry
     * @throws IllegalArgumentException if the column is not inside this chunk
     */
    public int materialAt(int x, int y, int z) {
        if (!pos.equals(ChunkPos.ofBlock(x, z, chunkSize))) {
            throw new IllegalArgumentException("Block (" + x + ", " + y + ", " + z + ") is not in chunk " + pos);
        }
        int index = Arrays.binarySearch(keys,
                BlockEntry.packKey(Math.floorMod(x, chunkSize), y, Math.floorMod(z, chunkSize)));
        return index < 0 ? Materials.AIR : BlockEntry.unpackMaterial(values[index]);
    }

    /**
     * @return every entry, including air tombstones
     */
    public List<BlockEntry> entries() {
        List<BlockEntry> list = new ArrayList<>(keys.length);
        for (int i = 0; i < keys.length; i++) {
            list.add(BlockEntry.unpack(keys[i], values[i]));
        }
        return list;
    }

    /**
     * @return every non-air entry
     */
    public List<BlockEntry> blocks() {
        List<BlockEntry> list = new ArrayList<>(keys.length);
        for (int i = 0; i < keys.length; i++) {
            if (BlockEntry.unpackMaterial(values[i]) != Materials.AIR) {
                list.add(BlockEntry.unpack(keys[i], values[i]));
            }
        }
        return list;
    }

    /**
     * Selects what a client already holding {@code knownRevision} is missing:
     * every entry written after that revision, removals included. A client
     * with no data ({@code knownRevision <= 0}) receives every entry, since
     * its locally generated terrain may hold blocks that were since removed.
     */
    public List<BlockEntry> entriesSince(int knownRevision) {
        int since = Math.max(knownRevision, 0);
        List<BlockEntry> list = new ArrayList<>();
        for (int i = 0; i < keys.length; i++) {
            if (BlockEntry.unpackRevision(values[i]) > since) {
                list.add(BlockEntry.unpack(keys[i], values[i]));
            }
        }
        return list;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChunkSnapshot other)) {
            return false;
        }
        return revision == other.revision
                && chunkSize == other.chunkSize
                && pos.equals(other.pos)
                && Arrays.equals(keys, other.keys)
                && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        int result = pos.hashCode();
        result = 31 * result + revision;
        result = 31 * result + Arrays.hashCode(keys);
        result = 31 * result + Arrays.hashCode(values);
        return result;
    }

    @Override
    public String toString() {
        return "ChunkSnapshot" + pos + "[revision=" + revision + ", entries=" + keys.length + "]";
    }
}
