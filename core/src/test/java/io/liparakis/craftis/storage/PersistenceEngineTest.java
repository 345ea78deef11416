package io.liparakis.craftis.storage;

import io.liparakis.craftis.world.ChunkLoadException;
import io.liparakis.craftis.world.ChunkLoader;
import io.liparakis.craftis.world.ChunkPos;
import io.liparakis.craftis.world.ChunkSnapshot;
import io.liparakis.craftis.world.Materials;
import io.liparakis.craftis.world.World;
import io.liparakis.craftis.world.WorldSettings;
import io.liparakis.craftis.world.gen.FlatTerrainGenerator;
import io.liparakis.craftis.world.gen.VoidTerrainGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class PersistenceEngineTest {

    private static final Duration LONG_INTERVAL = Duration.ofHours(1);

    @TempDir
    Path tempDir;

    // ========== Durability ==========

    @Test
    void editsSurviveRestart() throws IOException {
        ChunkStorage storage = new ChunkStorage(tempDir);
        World world = new World(WorldSettings.DEFAULT, new FlatTerrainGenerator(3), storage);
        PersistenceEngine engine = new PersistenceEngine(world, storage, LONG_INTERVAL, 1000, null);
        engine.start(new ChunkPos(0, 0), 0);

        world.setBlock(5, 10, 5, Materials.BRICK);
        world.setBlock(5, 3, 5, Materials.AIR);
        world.setBlock(-40, 1, 70, Materials.GLASS);
        ChunkSnapshot home = world.snapshotChunk(0, 0);
        ChunkSnapshot far = world.snapshotChunk(-2, 2);
        engine.close();

        ChunkStorage reopened = new ChunkStorage(tempDir);
        World restarted = new World(WorldSettings.DEFAULT, new FlatTerrainGenerator(3), reopened);
        try {
            assertThat(restarted.snapshotChunk(0, 0)).isEqualTo(home);
            assertThat(restarted.snapshotChunk(-2, 2)).isEqualTo(far);
            assertThat(restarted.getBlock(5, 3, 5)).isEqualTo(Materials.AIR);
            assertThat(restarted.dirtyChunkCount()).isZero();
        } finally {
            reopened.close();
        }
    }

    @Test
    void uneditedChunksAreNotWritten() throws IOException {
        ChunkStorage storage = new ChunkStorage(tempDir);
        World world = new World(WorldSettings.DEFAULT, new FlatTerrainGenerator(3), storage);
        PersistenceEngine engine = new PersistenceEngine(world, storage, LONG_INTERVAL, 1000, null);
        engine.start(new ChunkPos(0, 0), 1);

        assertThat(world.loadedChunkCount()).isEqualTo(9);
        assertThat(engine.flush().saved()).isZero();
        engine.close();
    }

    @Test
    void flushCleansDirtySet() throws IOException {
        ChunkStorage storage = new ChunkStorage(tempDir);
        World world = new World(WorldSettings.DEFAULT, VoidTerrainGenerator.INSTANCE, storage);
        PersistenceEngine engine = new PersistenceEngine(world, storage, LONG_INTERVAL, 1000, null);

        world.setBlock(0, 0, 0, Materials.STONE);
        world.setBlock(100, 0, 0, Materials.STONE);

        PersistenceEngine.FlushResult result = engine.flush();

        assertThat(result.saved()).isEqualTo(2);
        assertThat(result.failed()).isZero();
        assertThat(world.dirtyChunkCount()).isZero();
        engine.close();
    }

    // ========== Failure Handling ==========

    @Test
    void failedWriteIsRetriedNextCycle() throws IOException {
        ChunkStorage storage = mock(ChunkStorage.class);
        World world = new World(WorldSettings.DEFAULT, VoidTerrainGenerator.INSTANCE, ChunkLoader.NONE);
        PersistenceEngine engine = new PersistenceEngine(world, storage, LONG_INTERVAL, 1000, null);
        world.setBlock(0, 0, 0, Materials.STONE);

        doThrow(new StorageException("disk full")).when(storage).save(any());
        PersistenceEngine.FlushResult failed = engine.flush();

        assertThat(failed.failed()).isEqualTo(1);
        assertThat(world.dirtyChunkCount()).isEqualTo(1);

        doNothing().when(storage).save(any());
        PersistenceEngine.FlushResult retried = engine.flush();

        assertThat(retried.saved()).isEqualTo(1);
        assertThat(world.dirtyChunkCount()).isZero();
        engine.close();
        verify(storage).close();
    }

    @Test
    void unreadableRegionNeverReplacesSavedBlocks() throws IOException {
        ChunkStorage storage = new ChunkStorage(tempDir);
        World world = new World(WorldSettings.DEFAULT, VoidTerrainGenerator.INSTANCE, storage);
        PersistenceEngine engine = new PersistenceEngine(world, storage, LONG_INTERVAL, 1000, null);
        world.setBlock(1, 10, 1, Materials.BRICK);
        world.setBlock(2, 10, 2, Materials.GLASS);
        engine.close();

        Path region = tempDir.resolve("r.0.0.cra");
        Path aside = tempDir.resolve("r.0.0.cra.aside");
        Files.move(region, aside);
        Files.createDirectory(region);

        ChunkStorage reopened = new ChunkStorage(tempDir);
        World restarted = new World(WorldSettings.DEFAULT, VoidTerrainGenerator.INSTANCE, reopened);
        engine = new PersistenceEngine(restarted, reopened, LONG_INTERVAL, 1000, null);
        engine.start(new ChunkPos(0, 0), 1);

        assertThat(restarted.isLoaded(new ChunkPos(0, 0))).isFalse();
        assertThat(restarted.isLoaded(new ChunkPos(-1, -1))).isTrue();
        assertThatThrownBy(() -> restarted.setBlock(3, 10, 3, Materials.SAND))
                .isInstanceOf(ChunkLoadException.class);

        Files.delete(region);
        Files.move(aside, region);
        restarted.setBlock(3, 10, 3, Materials.SAND);
        engine.close();

        ChunkStorage last = new ChunkStorage(tempDir);
        try {
            World verified = new World(WorldSettings.DEFAULT, VoidTerrainGenerator.INSTANCE, last);
            assertThat(verified.getBlock(1, 10, 1)).isEqualTo(Materials.BRICK);
            assertThat(verified.getBlock(2, 10, 2)).isEqualTo(Materials.GLASS);
            assertThat(verified.getBlock(3, 10, 3)).isEqualTo(Materials.SAND);
        } finally {
            last.close();
        }
    }

    @Test
    void dirtyThresholdTriggersBackgroundFlush() throws IOException {
        ChunkStorage storage = mock(ChunkStorage.class);
        World world = new World(WorldSettings.DEFAULT, VoidTerrainGenerator.INSTANCE, ChunkLoader.NONE);
        PersistenceEngine engine = new PersistenceEngine(world, storage, LONG_INTERVAL, 2, null);
        engine.start(new ChunkPos(0, 0), 0);

        world.setBlock(0, 0, 0, Materials.STONE);
        world.setBlock(100, 0, 0, Materials.STONE);

        verify(storage, timeout(5000).times(2)).save(any());
        engine.close();
    }

    @Test
    void idleCleanChunksAreUnloadedAfterFlush() throws IOException {
        ChunkStorage storage = new ChunkStorage(tempDir);
        World world = new World(WorldSettings.DEFAULT, VoidTerrainGenerator.INSTANCE, storage);
        PersistenceEngine engine = new PersistenceEngine(world, storage, LONG_INTERVAL, 1000, Duration.ZERO);

        world.setBlock(0, 0, 0, Materials.STONE);
        PersistenceEngine.FlushResult result = engine.flush();

        assertThat(result.unloaded()).isEqualTo(1);
        assertThat(world.isLoaded(new ChunkPos(0, 0))).isFalse();
        assertThat(world.getBlock(0, 0, 0)).isEqualTo(Materials.STONE);
        engine.close();
    }
}
