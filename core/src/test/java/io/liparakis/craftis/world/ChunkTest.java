package io.liparakis.craftis.world;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkTest {

    // ========== Edits ==========

    @Test
    void setBumpsRevisionAndMarksDirty() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 32);

        int first = chunk.set(1, 10, 2, Materials.STONE);
        int second = chunk.set(1, 11, 2, Materials.GRASS);

        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(2);
        assertThat(chunk.revision()).isEqualTo(2);
        assertThat(chunk.isDirty()).isTrue();
        assertThat(chunk.getMaterial(1, 10, 2)).isEqualTo(Materials.STONE);
    }

    @Test
    void placingOverExistingBlockReplacesIt() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 32);
        chunk.set(0, 0, 0, Materials.STONE);

        chunk.set(0, 0, 0, Materials.BRICK);

        assertThat(chunk.getMaterial(0, 0, 0)).isEqualTo(Materials.BRICK);
        assertThat(chunk.entryCount()).isEqualTo(1);
    }

    @Test
    void removalLeavesTombstoneWithItsRevision() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 32);
        chunk.set(3, 5, 3, Materials.WOOD);

        int removedAt = chunk.set(3, 5, 3, Materials.AIR);

        assertThat(chunk.getMaterial(3, 5, 3)).isEqualTo(Materials.AIR);
        assertThat(chunk.snapshot().entries())
                .containsExactly(new BlockEntry(3, 5, 3, Materials.AIR, removedAt));
    }

    @Test
    void rejectsLocalOffsetOutsideChunk() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 16);

        assertThatThrownBy(() -> chunk.set(16, 0, 0, Materials.STONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> chunk.set(0, 0, -1, Materials.STONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsInvalidSize() {
        assertThatThrownBy(() -> new Chunk(new ChunkPos(0, 0), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Chunk(new ChunkPos(0, 0), 257))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ========== Restore ==========

    @Test
    void restoreDoesNotMarkDirtyButRaisesRevision() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 32);

        chunk.restore(0, 1, 0, Materials.SAND, 7);

        assertThat(chunk.isDirty()).isFalse();
        assertThat(chunk.revision()).isEqualTo(7);
        assertThat(chunk.getMaterial(0, 1, 0)).isEqualTo(Materials.SAND);
    }

    @Test
    void restoreRevisionNeverLowersRevision() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 32);
        chunk.restoreRevision(10);
        chunk.restoreRevision(4);

        assertThat(chunk.revision()).isEqualTo(10);
        assertThat(chunk.set(0, 0, 0, Materials.STONE)).isEqualTo(11);
    }

    // ========== Dirty Flag ==========

    @Test
    void markSavedClearsDirtyOnlyForCurrentRevision() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 32);
        int saved = chunk.set(0, 0, 0, Materials.STONE);
        chunk.set(1, 0, 0, Materials.STONE);

        assertThat(chunk.markSaved(saved)).isFalse();
        assertThat(chunk.isDirty()).isTrue();

        assertThat(chunk.markSaved(chunk.revision())).isTrue();
        assertThat(chunk.isDirty()).isFalse();
    }

    // ========== Snapshots ==========

    @Test
    void snapshotsOfEqualContentAreEqualRegardlessOfWriteOrder() {
        Chunk a = new Chunk(new ChunkPos(2, 3), 32);
        Chunk b = new Chunk(new ChunkPos(2, 3), 32);
        a.restore(5, 1, 5, Materials.STONE, 1);
        a.restore(0, 2, 0, Materials.DIRT, 1);
        b.restore(0, 2, 0, Materials.DIRT, 1);
        b.restore(5, 1, 5, Materials.STONE, 1);

        assertThat(a.snapshot()).isEqualTo(b.snapshot());
        assertThat(a.snapshot().hashCode()).isEqualTo(b.snapshot().hashCode());
    }

    @Test
    void snapshotIsIsolatedFromLaterEdits() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 32);
        chunk.set(0, 0, 0, Materials.STONE);
        ChunkSnapshot before = chunk.snapshot();

        chunk.set(0, 0, 0, Materials.GLASS);

        assertThat(before.materialAt(0, 0, 0)).isEqualTo(Materials.STONE);
        assertThat(before.revision()).isEqualTo(1);
    }

    @Test
    void negativeYIsStoredAndReadBack() {
        Chunk chunk = new Chunk(new ChunkPos(-1, -1), 32);
        chunk.set(31, -64, 31, Materials.COBBLE);

        assertThat(chunk.getMaterial(31, -64, 31)).isEqualTo(Materials.COBBLE);
        assertThat(chunk.snapshot().entries().get(0).y()).isEqualTo(-64);
    }
}
