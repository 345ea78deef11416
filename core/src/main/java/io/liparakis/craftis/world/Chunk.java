package io.liparakis.craftis.world;

import it.unimi.dsi.fastutil.ints.Int2LongOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * Voxel storage for one chunk.
 * <p>
 * Entries are kept in a primitive map from packed local position to packed
 * (revision, material) value, so neither keys nor values are boxed. Removed
 * blocks stay behind as air entries carrying the revision of their removal,
 * which lets a client holding an older revision learn about the removal.
 * </p>
 * <p>
 * All access goes through this instance's monitor. {@link World} additionally
 * synchronizes on the chunk around multi-step operations (edit plus listener
 * notification), which is safe because the monitor is re-entrant.
 * </p>
 *
 * @see BlockEntry
 * @see ChunkSnapshot
 */
public final class Chunk {
    private static final int INITIAL_CAPACITY = 64;
    private static final long MISSING = Long.MIN_VALUE;

    private final ChunkPos pos;
    private final int size;

    /**
     * Packed local position to packed (revision, material).
     */
    private final Int2LongOpenHashMap entries;

    /**
     * Bumped by every applied edit; never decreases.
     */
    private int revision;

    /**
     * Set by edits, cleared once a flush has persisted the current revision.
     */
    private boolean dirty;

    /**
     * Set when the chunk has been evicted from its world; a retired instance
     * must not accept further edits.
     */
    private boolean retired;

    private volatile long lastAccessNanos;

    public Chunk(ChunkPos pos, int size) {
        if (size < 1 || size > BlockEntry.MAX_LOCAL) {
            throw new IllegalArgumentException("Chunk size out of bounds: " + size);
        }
        this.pos = pos;
        this.size = size;
        this.entries = new Int2LongOpenHashMap(INITIAL_CAPACITY);
        this.entries.defaultReturnValue(MISSING);
        this.lastAccessNanos = System.nanoTime();
    }

    public ChunkPos pos() {
        return pos;
    }

    public int size() {
        return size;
    }

    // ==================== Edits ====================

    /**
     * Applies an edit and returns the revision it produced.
     *
     * @param x        local x offset
     * @param y        absolute y
     * @param z        local z offset
     * @param material the new material, {@link Materials#AIR} to remove
     * @return the new chunk revision
     */
    public synchronized int set(int x, int y, int z, int material) {
        checkLocal(x, z);
        revision++;
        entries.put(BlockEntry.packKey(x, y, z), BlockEntry.packValue(material, revision));
        dirty = true;
        return revision;
    }

    /**
     * Restores an entry from storage or terrain generation without marking
     * the chunk dirty. The chunk revision is raised to at least the entry's.
     */
    public synchronized void restore(int x, int y, int z, int material, int entryRevision) {
        checkLocal(x, z);
        entries.put(BlockEntry.packKey(x, y, z), BlockEntry.packValue(material, entryRevision));
        if (entryRevision > revision) {
            revision = entryRevision;
        }
    }

    /**
     * Raises the chunk revision to at least the given value, used when a
     * persisted chunk is reloaded.
     */
    public synchronized void restoreRevision(int savedRevision) {
        if (savedRevision > revision) {
            revision = savedRevision;
        }
    }

    private void checkLocal(int x, int z) {
        if (x < 0 || x >= size || z < 0 || z >= size) {
            throw new IllegalArgumentException("Local offset (" + x + ", " + z + ") outside chunk of size " + size);
        }
    }

    // ==================== Queries ====================

    /**
     * @return the material at a local position, air if nothing is stored
     */
    public synchronized int getMaterial(int x, int y, int z) {
        long value = entries.get(BlockEntry.packKey(x, y, z));
        return value == MISSING ? Materials.AIR : BlockEntry.unpackMaterial(value);
    }

    public synchronized int revision() {
        return revision;
    }

    public synchronized int entryCount() {
        return entries.size();
    }

    /**
     * Takes an immutable copy of every entry, tombstones included, ordered by
     * position key.
     */
    public synchronized ChunkSnapshot snapshot() {
        int[] keys = entries.keySet().toIntArray();
        IntArrays.quickSort(keys);
        long[] values = new long[keys.length];
        for (int i = 0; i < keys.length; i++) {
            values[i] = entries.get(keys[i]);
        }
        return new ChunkSnapshot(pos, size, revision, keys, values);
    }

    // ==================== Dirty Flag ====================

    public synchronized boolean isDirty() {
        return dirty;
    }

    /**
     * Clears the dirty flag if no edit happened after the persisted revision.
     *
     * @param savedRevision the revision that was written to storage
     * @return {@code true} if the chunk is now clean
     */
    public synchronized boolean markSaved(int savedRevision) {
        if (revision == savedRevision) {
            dirty = false;
        }
        return !dirty;
    }

    // ==================== Lifecycle ====================

    synchronized boolean isRetired() {
        return retired;
    }

    synchronized void retire() {
        retired = true;
    }

    void touch() {
        lastAccessNanos = System.nanoTime();
    }

    long lastAccessNanos() {
        return lastAccessNanos;
    }

    @Override
    public String toString() {
        return "Chunk" + pos;
    }
}
