package io.liparakis.craftis.storage;

import io.liparakis.craftis.Craftis;
import io.liparakis.craftis.world.Chunk;
import io.liparakis.craftis.world.ChunkLoadException;
import io.liparakis.craftis.world.ChunkPos;
import io.liparakis.craftis.world.ChunkSnapshot;
import io.liparakis.craftis.world.World;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Moves dirty chunks from the world to durable storage.
 * <p>
 * Flushes run on a single background thread: periodically, and early when
 * the world reports that enough chunks are dirty. Each dirty chunk is
 * snapshotted, written, and marked saved at the snapshot's revision, so an
 * edit landing mid-flush keeps the chunk dirty for the next cycle. A failed
 * write leaves the chunk dirty and is retried next cycle; storage errors never
 * stop the server.
 * </p>
 */
public final class PersistenceEngine implements AutoCloseable {
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final World world;
    private final ChunkStorage storage;
    private final Duration saveInterval;
    private final int dirtyThreshold;
    private final @Nullable Duration unloadIdle;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "craftis-persistence");
        thread.setDaemon(true);
        return thread;
    });
    private final ReentrantLock flushLock = new ReentrantLock();
    private final AtomicBoolean flushRequested = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param saveInterval   period between flushes
     * @param dirtyThreshold dirty-chunk count that triggers an early flush
     * @param unloadIdle     idle time after which clean chunks are evicted
     *                       after a flush, or {@code null} to keep every chunk
     */
    public PersistenceEngine(World world, ChunkStorage storage, Duration saveInterval, int dirtyThreshold,
                             @Nullable Duration unloadIdle) {
        this.world = Objects.requireNonNull(world, "world");
        this.storage = Objects.requireNonNull(storage, "storage");
        if (saveInterval.isNegative() || saveInterval.isZero()) {
            throw new IllegalArgumentException("Save interval must be positive: " + saveInterval);
        }
        this.saveInterval = saveInterval;
        this.dirtyThreshold = dirtyThreshold;
        this.unloadIdle = unloadIdle;
    }

    /**
     * Preloads the chunks around {@code center} and starts background
     * flushing.
     *
     * @param radius Chebyshev radius, in chunks, of the preloaded square
     */
    public void start(ChunkPos center, int radius) {
        int preloaded = 0;
        for (int dp = -radius; dp <= radius; dp++) {
            for (int dq = -radius; dq <= radius; dq++) {
                try {
                    world.getOrLoadChunk(center.p() + dp, center.q() + dq);
                    preloaded++;
                } catch (ChunkLoadException e) {
                    // Left unloaded; the first reference retries.
                    Craftis.LOGGER.error("Failed to preload chunk {}", e.pos(), e);
                }
            }
        }
        Craftis.LOGGER.info("Preloaded {} chunks around {}", preloaded, center);

        world.onDirtyThreshold(dirtyThreshold, this::requestFlush);
        long periodMillis = saveInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::flushInBackground, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Schedules an early flush unless one is already pending.
     */
    public void requestFlush() {
        if (closed.get() || !flushRequested.compareAndSet(false, true)) {
            return;
        }
        try {
            scheduler.execute(this::flushInBackground);
        } catch (RejectedExecutionException e) {
            flushRequested.set(false);
        }
    }

    private void flushInBackground() {
        flushRequested.set(false);
        try {
            flush();
        } catch (RuntimeException e) {
            Craftis.LOGGER.error("Unexpected failure during background flush", e);
        }
    }

    /**
     * Writes every dirty chunk. Concurrent calls run one after another.
     *
     * @return the outcome of this cycle
     */
    public FlushResult flush() {
        flushLock.lock();
        try {
            int saved = 0;
            int failed = 0;
            for (Chunk chunk : world.dirtyChunks()) {
                ChunkSnapshot snapshot = chunk.snapshot();
                try {
                    storage.save(snapshot);
                    world.markSaved(chunk, snapshot.revision());
                    saved++;
                } catch (IOException e) {
                    failed++;
                    Craftis.LOGGER.warn("Failed to save chunk {} - will retry next cycle", chunk.pos(), e);
                }
            }

            try {
                storage.flush();
            } catch (IOException e) {
                Craftis.LOGGER.warn("Failed to sync region headers - will retry next cycle", e);
            }

            int unloaded = 0;
            if (unloadIdle != null) {
                unloaded = world.unloadIdleChunks(unloadIdle, Set.of());
            }

            if (saved > 0 || failed > 0 || unloaded > 0) {
                Craftis.LOGGER.debug("Flush: {} saved, {} failed, {} unloaded", saved, failed, unloaded);
            }
            return new FlushResult(saved, failed, unloaded);
        } finally {
            flushLock.unlock();
        }
    }

    /**
     * Stops background flushing, writes everything still dirty, then
     * compacts and closes storage.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                Craftis.LOGGER.warn("Background flush did not finish within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        FlushResult last = flush();
        if (last.failed() > 0) {
            Craftis.LOGGER.error("{} chunks could not be saved during shutdown", last.failed());
        }
        storage.close();
        Craftis.LOGGER.info("World saved ({} chunks in final flush)", last.saved());
    }

    /**
     * Outcome of one flush cycle.
     *
     * @param saved    chunks written
     * @param failed   chunks whose write failed and stay dirty
     * @param unloaded clean idle chunks evicted afterwards
     */
    public record FlushResult(int saved, int failed, int unloaded) {
    }
}
