package io.liparakis.craftis.storage;

import io.liparakis.craftis.Craftis;
import io.liparakis.craftis.world.Chunk;
import io.liparakis.craftis.world.ChunkLoader;
import io.liparakis.craftis.world.ChunkPos;
import io.liparakis.craftis.world.ChunkSnapshot;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Region-based durable storage for chunks.
 * Features:
 * - Region file format (32x32 chunks per file)
 * - LRU caching of open region files
 * - Thread-safe compression/decompression
 * - Checksummed records; a corrupt record reads as absent, any other read
 *   failure propagates
 */
public final class ChunkStorage implements ChunkLoader, AutoCloseable {

    /**
     * The directory where .cra region files are stored.
     */
    private final Path storageDir;

    /**
     * LRU cache of open region files, most recently used last.
     */
    private final Object2ObjectLinkedOpenHashMap<RegionKey, RegionFile> regionCache;
    private final int maxCachedRegions;

    /**
     * Evicted regions still in use, closed by their last user.
     */
    private final Map<RegionKey, RegionFile> retiring = new ConcurrentHashMap<>();

    /**
     * Guards the region cache. Held only for lookup, open and eviction, never
     * across a region read or write.
     */
    private final ReentrantLock cacheLock = new ReentrantLock();

    /**
     * Thread-local compression state to allow concurrent save/load without
     * re-allocation.
     */
    private final ThreadLocal<CompressionContext> compressionContext = ThreadLocal.withInitial(CompressionContext::new);

    public ChunkStorage(Path storageDir) throws IOException {
        this(storageDir, StorageConstants.MAX_CACHED_REGIONS);
    }

    public ChunkStorage(Path storageDir, int maxCachedRegions) throws IOException {
        if (maxCachedRegions < 1) {
            throw new IllegalArgumentException("Region cache must hold at least one region: " + maxCachedRegions);
        }
        this.storageDir = Files.createDirectories(storageDir);
        this.maxCachedRegions = maxCachedRegions;
        this.regionCache = new Object2ObjectLinkedOpenHashMap<>(maxCachedRegions);
    }

    public Path directory() {
        return storageDir;
    }

    /**
     * Saves a chunk snapshot. An empty snapshot clears the stored chunk.
     *
     * @throws IOException if the record could not be made durable; whatever
     *                     was stored before stays readable
     */
    public void save(ChunkSnapshot snapshot) throws IOException {
        ChunkPos pos = snapshot.pos();
        if (snapshot.entryCount() == 0) {
            withRegion(pos, false, region -> {
                region.write(pos, null);
                return null;
            });
            return;
        }

        byte[] compressedData = compressionContext.get().compress(ChunkCodec.encode(snapshot));
        withRegion(pos, true, region -> {
            region.write(pos, compressedData);
            return null;
        });
    }

    /**
     * Loads a chunk from storage.
     *
     * @return the restored chunk, or {@code null} if it was never stored or
     *         the stored record is corrupt
     * @throws IOException if the region could not be read; the stored record
     *                     may be intact, so callers must not overwrite it
     */
    @Override
    public @Nullable Chunk load(ChunkPos pos) throws IOException {
        try {
            byte[] compressedData = withRegion(pos, false, region -> region.read(pos));
            if (compressedData == null) {
                return null;
            }

            byte[] decompressed = compressionContext.get().decompress(compressedData);
            return ChunkCodec.decode(decompressed, pos);
        } catch (StorageException e) {
            // Left in place; the next save of this chunk supersedes it.
            Craftis.LOGGER.warn("Corrupt record for chunk {} - regenerating. Error: {}", pos, e.getMessage());
            return null;
        }
    }

    /**
     * Forces pending header updates of every open region to disk.
     */
    public void flush() throws IOException {
        List<RegionFile> regions = retainCached();
        IOException failure = null;
        try {
            for (RegionFile regionFile : regions) {
                try {
                    regionFile.flush();
                } catch (IOException e) {
                    if (failure == null) {
                        failure = e;
                    } else {
                        failure.addSuppressed(e);
                    }
                }
            }
        } finally {
            regions.forEach(this::release);
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * @return number of region files currently cached
     */
    public int openRegionCount() {
        cacheLock.lock();
        try {
            return regionCache.size();
        } finally {
            cacheLock.unlock();
        }
    }

    /**
     * Compacts and closes all cached region files. A region still in use is
     * closed by its last user.
     */
    @Override
    public void close() {
        List<RegionFile> regions;
        cacheLock.lock();
        try {
            regions = new ArrayList<>(regionCache.values());
            regionCache.clear();
            regions.forEach(RegionFile::retain);
            regions.forEach(RegionFile::retire);
        } finally {
            cacheLock.unlock();
        }

        for (RegionFile regionFile : regions) {
            try {
                regionFile.compact();
            } catch (IOException e) {
                Craftis.LOGGER.warn("Failed to compact region {}", regionFile.path().getFileName(), e);
            }
            release(regionFile);
        }
        compressionContext.remove();
    }

    /**
     * Runs {@code action} against the region holding {@code pos}. The cache
     * lock is held only while the region is looked up; the action itself runs
     * unlocked, and an evicted region stays open until its last action ends.
     *
     * @param create whether to create the region file if it does not exist yet
     * @return the action's result, or {@code null} if the region is absent and
     *         was not created
     */
    <T> @Nullable T withRegion(ChunkPos pos, boolean create, RegionAction<T> action) throws IOException {
        RegionFile regionFile = acquire(RegionKey.of(pos), create);
        if (regionFile == null) {
            return null;
        }
        try {
            return action.apply(regionFile);
        } finally {
            release(regionFile);
        }
    }

    /**
     * Gets or opens a region file, using LRU caching, and retains it for the
     * caller.
     */
    private @Nullable RegionFile acquire(RegionKey key, boolean create) throws IOException {
        RegionFile evicted = null;
        RegionFile regionFile;
        cacheLock.lock();
        try {
            regionFile = regionCache.getAndMoveToLast(key);
            if (regionFile != null) {
                regionFile.retain();
                return regionFile;
            }

            // An evicted region that is still in use must not be opened twice.
            regionFile = retiring.remove(key);
            if (regionFile == null || !regionFile.retain()) {
                if (!create && !Files.exists(storageDir.resolve(key.fileName()))) {
                    return null;
                }
                regionFile = new RegionFile(storageDir, key);
                regionFile.retain();
            }

            if (regionCache.size() >= maxCachedRegions) {
                evicted = evictOldestRegion();
            }
            regionCache.putAndMoveToLast(key, regionFile);
        } finally {
            cacheLock.unlock();
        }

        if (evicted != null) {
            closeRetired(evicted);
        }
        return regionFile;
    }

    /**
     * Removes the least recently used region from the cache. Caller holds
     * the cache lock.
     *
     * @return the region if nobody is using it and it must be closed now
     */
    private @Nullable RegionFile evictOldestRegion() {
        RegionFile oldest = regionCache.removeFirst();
        if (oldest.retire()) {
            return oldest;
        }
        retiring.put(oldest.key(), oldest);
        return null;
    }

    /**
     * Retains every cached region.
     */
    private List<RegionFile> retainCached() {
        cacheLock.lock();
        try {
            List<RegionFile> regions = new ArrayList<>(regionCache.values());
            regions.forEach(RegionFile::retain);
            return regions;
        } finally {
            cacheLock.unlock();
        }
    }

    private void release(RegionFile regionFile) {
        if (regionFile.release()) {
            closeRetired(regionFile);
        }
    }

    private void closeRetired(RegionFile regionFile) {
        retiring.remove(regionFile.key(), regionFile);
        try {
            regionFile.close();
        } catch (IOException e) {
            Craftis.LOGGER.warn("Failed to close region {}", regionFile.path().getFileName(), e);
        }
    }

    @FunctionalInterface
    interface RegionAction<T> {
        T apply(RegionFile region) throws IOException;
    }
}
