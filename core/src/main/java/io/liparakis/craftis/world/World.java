package io.liparakis.craftis.world;

import io.liparakis.craftis.Craftis;
import io.liparakis.craftis.world.gen.TerrainGenerator;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * The authoritative voxel world: every loaded chunk plus the dirty set the
 * persistence engine drains.
 * <p>
 * Concurrency model:
 * <ul>
 *   <li>The chunk table is a {@link ConcurrentHashMap}; loading or generating a
 *   chunk happens outside any shared lock, and a losing racer adopts the
 *   instance inserted first.</li>
 *   <li>Edits lock only the owning chunk, so edits to different chunks never
 *   contend and edits to one chunk are linearizable.</li>
 *   <li>{@link WorldListener}s run under the chunk lock, so fan-out order per
 *   chunk matches serialization order.</li>
 * </ul>
 * </p>
 */
public final class World {
    private final WorldSettings settings;
    private final TerrainGenerator generator;
    private final ChunkLoader loader;

    private final Map<ChunkPos, Chunk> chunks = new ConcurrentHashMap<>();
    private final Set<ChunkPos> dirtyChunks = ConcurrentHashMap.newKeySet();
    private final List<WorldListener> listeners = new CopyOnWriteArrayList<>();

    private volatile int dirtyThreshold = Integer.MAX_VALUE;
    private volatile Runnable dirtyThresholdCallback = () -> {
    };

    public World(WorldSettings settings, TerrainGenerator generator, ChunkLoader loader) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public WorldSettings settings() {
        return settings;
    }

    public void addListener(WorldListener listener) {
        listeners.add(listener);
    }

    public void removeListener(WorldListener listener) {
        listeners.remove(listener);
    }

    /**
     * Registers a callback fired (outside any chunk lock) after an edit leaves
     * at least {@code threshold} chunks dirty.
     */
    public void onDirtyThreshold(int threshold, Runnable callback) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Dirty threshold must be positive: " + threshold);
        }
        this.dirtyThresholdCallback = Objects.requireNonNull(callback, "callback");
        this.dirtyThreshold = threshold;
    }

    // ==================== Chunk Access ====================

    /**
     * Returns the loaded chunk, loading it from storage or generating it on
     * first reference.
     *
     * @throws ChunkLoadException if storage could not be read; nothing is
     *                            cached and the next call retries
     */
    public Chunk getOrLoadChunk(int p, int q) {
        return getOrLoadChunk(new ChunkPos(p, q));
    }

    public Chunk getOrLoadChunk(ChunkPos pos) {
        Chunk existing = chunks.get(pos);
        if (existing != null) {
            existing.touch();
            return existing;
        }

        Chunk created = loadOrGenerate(pos);
        Chunk raced = chunks.putIfAbsent(pos, created);
        return raced != null ? raced : created;
    }

    private Chunk loadOrGenerate(ChunkPos pos) {
        Chunk stored;
        try {
            stored = loader.load(pos);
        } catch (IOException e) {
            throw new ChunkLoadException(pos, e);
        }

        if (stored != null) {
            if (stored.size() != settings.chunkSize()) {
                Craftis.LOGGER.error("Stored chunk {} has size {} but the world uses {} - regenerating",
                        pos, stored.size(), settings.chunkSize());
            } else {
                BlockEntry invalid = firstInvalidEntry(stored);
                if (invalid == null) {
                    return stored;
                }
                Craftis.LOGGER.error("Stored chunk {} holds {} outside the world's bounds - regenerating",
                        pos, invalid);
            }
        }

        Chunk chunk = new Chunk(pos, settings.chunkSize());
        generator.generate(chunk, settings);
        return chunk;
    }

    private @Nullable BlockEntry firstInvalidEntry(Chunk chunk) {
        for (BlockEntry entry : chunk.snapshot().entries()) {
            if (!settings.isInVerticalRange(entry.y()) || !settings.isValidMaterial(entry.material())) {
                return entry;
            }
        }
        return null;
    }

    public boolean isLoaded(ChunkPos pos) {
        return chunks.containsKey(pos);
    }

    public int loadedChunkCount() {
        return chunks.size();
    }

    // ==================== Edits ====================

    /**
     * Applies a block edit. Placing over an existing block replaces it;
     * placing air removes it.
     *
     * @return the applied change, for fan-out
     * @throws BlockOutOfRangeException if {@code y} is outside the vertical
     *                                  bounds or the material is not accepted
     */
    public BlockChange setBlock(int x, int y, int z, int material) {
        if (!settings.isInVerticalRange(y)) {
            throw new BlockOutOfRangeException("y=" + y + " outside [" + settings.minY() + ", " + settings.maxY() + "]");
        }
        if (!settings.isValidMaterial(material)) {
            throw new BlockOutOfRangeException("Material " + material + " outside [0, " + settings.maxMaterialId() + "]");
        }

        int size = settings.chunkSize();
        ChunkPos pos = ChunkPos.ofBlock(x, z, size);
        int localX = Math.floorMod(x, size);
        int localZ = Math.floorMod(z, size);

        BlockChange change = null;
        while (change == null) {
            Chunk chunk = getOrLoadChunk(pos);
            synchronized (chunk) {
                if (chunk.isRetired()) {
                    // Evicted between lookup and lock; the table no longer holds it.
                    continue;
                }
                int revision = chunk.set(localX, y, localZ, material);
                dirtyChunks.add(pos);
                change = new BlockChange(pos, x, y, z, material, revision);
                notifyListeners(change);
            }
        }

        if (dirtyChunks.size() >= dirtyThreshold) {
            dirtyThresholdCallback.run();
        }
        return change;
    }

    private void notifyListeners(BlockChange change) {
        for (WorldListener listener : listeners) {
            try {
                listener.blockChanged(change);
            } catch (RuntimeException e) {
                Craftis.LOGGER.error("World listener failed for change at ({}, {}, {})",
                        change.x(), change.y(), change.z(), e);
            }
        }
    }

    public int getBlock(int x, int y, int z) {
        int size = settings.chunkSize();
        Chunk chunk = getOrLoadChunk(ChunkPos.ofBlock(x, z, size));
        return chunk.getMaterial(Math.floorMod(x, size), y, Math.floorMod(z, size));
    }

    // ==================== Snapshots ====================

    /**
     * @return an immutable copy of a chunk's full contents
     */
    public ChunkSnapshot snapshotChunk(int p, int q) {
        return getOrLoadChunk(p, q).snapshot();
    }

    /**
     * Hands a snapshot to {@code sink} while the chunk is still locked, so
     * nothing the sink enqueues can be overtaken by the fan-out of a later
     * edit. The sink must not block.
     */
    public void streamChunk(ChunkPos pos, Consumer<ChunkSnapshot> sink) {
        Chunk chunk = getOrLoadChunk(pos);
        synchronized (chunk) {
            sink.accept(chunk.snapshot());
        }
    }

    // ==================== Persistence Hooks ====================

    /**
     * @return the currently dirty chunks
     */
    public List<Chunk> dirtyChunks() {
        List<Chunk> list = new ArrayList<>(dirtyChunks.size());
        for (ChunkPos pos : dirtyChunks) {
            Chunk chunk = chunks.get(pos);
            if (chunk != null) {
                list.add(chunk);
            } else {
                dirtyChunks.remove(pos);
            }
        }
        return list;
    }

    public int dirtyChunkCount() {
        return dirtyChunks.size();
    }

    /**
     * Records that {@code revision} of a chunk reached durable storage.
     * The chunk stays dirty if it was edited after that revision.
     */
    public void markSaved(Chunk chunk, int revision) {
        synchronized (chunk) {
            if (chunk.markSaved(revision)) {
                dirtyChunks.remove(chunk.pos());
            }
        }
    }

    /**
     * @return every loaded chunk, in no particular order
     */
    public List<Chunk> loadedChunks() {
        return new ArrayList<>(chunks.values());
    }

    /**
     * Evicts clean chunks not accessed for at least {@code idle}. Dirty chunks
     * always stay loaded until flushed.
     *
     * @param keep chunks to keep regardless of idleness
     * @return number of evicted chunks
     */
    public int unloadIdleChunks(Duration idle, Set<ChunkPos> keep) {
        long cutoff = System.nanoTime() - idle.toNanos();
        int unloaded = 0;
        for (Chunk chunk : chunks.values()) {
            if (keep.contains(chunk.pos()) || chunk.lastAccessNanos() - cutoff > 0) {
                continue;
            }
            synchronized (chunk) {
                if (!chunk.isDirty() && !chunk.isRetired()) {
                    chunk.retire();
                    chunks.remove(chunk.pos(), chunk);
                    unloaded++;
                }
            }
        }
        return unloaded;
    }
}
