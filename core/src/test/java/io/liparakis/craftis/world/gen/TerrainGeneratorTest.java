package io.liparakis.craftis.world.gen;

import io.liparakis.craftis.world.Chunk;
import io.liparakis.craftis.world.ChunkPos;
import io.liparakis.craftis.world.Materials;
import io.liparakis.craftis.world.WorldSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TerrainGeneratorTest {

    private static final WorldSettings SETTINGS = new WorldSettings(16, 0, 255, 255);

    // ========== Lookup ==========

    @Test
    void byNameResolvesEveryGenerator() {
        assertThat(TerrainGenerator.byName("flat", 0, 10)).isInstanceOf(FlatTerrainGenerator.class);
        assertThat(TerrainGenerator.byName("HILLS", 0, 10)).isInstanceOf(HillsTerrainGenerator.class);
        assertThat(TerrainGenerator.byName("void", 0, 10)).isSameAs(VoidTerrainGenerator.INSTANCE);
    }

    @Test
    void byNameRejectsUnknownName() {
        assertThatThrownBy(() -> TerrainGenerator.byName("islands", 0, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("islands");
    }

    // ========== Flat ==========

    @Test
    void flatLayersStoneDirtAndGrass() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 16);
        new FlatTerrainGenerator(5).generate(chunk, SETTINGS);

        assertThat(chunk.getMaterial(3, 0, 3)).isEqualTo(Materials.STONE);
        assertThat(chunk.getMaterial(3, 1, 3)).isEqualTo(Materials.STONE);
        assertThat(chunk.getMaterial(3, 2, 3)).isEqualTo(Materials.DIRT);
        assertThat(chunk.getMaterial(3, 4, 3)).isEqualTo(Materials.DIRT);
        assertThat(chunk.getMaterial(3, 5, 3)).isEqualTo(Materials.GRASS);
        assertThat(chunk.getMaterial(3, 6, 3)).isEqualTo(Materials.AIR);
        assertThat(chunk.entryCount()).isEqualTo(16 * 16 * 6);
        assertThat(chunk.revision()).isEqualTo(TerrainGenerator.GENERATED_REVISION);
        assertThat(chunk.isDirty()).isFalse();
    }

    @Test
    void flatBelowMinYGeneratesNothing() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 16);
        new FlatTerrainGenerator(-5).generate(chunk, SETTINGS);

        assertThat(chunk.entryCount()).isZero();
    }

    // ========== Hills ==========

    @Test
    void hillsIsDeterministicForSeed() {
        Chunk a = new Chunk(new ChunkPos(3, -2), 16);
        Chunk b = new Chunk(new ChunkPos(3, -2), 16);

        new HillsTerrainGenerator(42L, 30).generate(a, SETTINGS);
        new HillsTerrainGenerator(42L, 30).generate(b, SETTINGS);

        assertThat(a.snapshot()).isEqualTo(b.snapshot());
    }

    @Test
    void hillsSurfaceMatchesHeightMap() {
        HillsTerrainGenerator generator = new HillsTerrainGenerator(7L, 40);
        Chunk chunk = new Chunk(new ChunkPos(1, 1), 16);
        generator.generate(chunk, SETTINGS);

        int height = generator.heightAt(16 + 4, 16 + 9);
        assertThat(chunk.getMaterial(4, height, 9)).isEqualTo(Materials.GRASS);
        assertThat(chunk.getMaterial(4, height + 1, 9)).isEqualTo(Materials.AIR);
        assertThat(height).isBetween(40 - 15, 40 + 15);
    }

    @Test
    void hillsVariesWithSeed() {
        HillsTerrainGenerator one = new HillsTerrainGenerator(1L, 40);
        HillsTerrainGenerator two = new HillsTerrainGenerator(2L, 40);

        boolean differs = false;
        for (int x = 0; x < 256 && !differs; x += 7) {
            differs = one.heightAt(x, x * 3) != two.heightAt(x, x * 3);
        }
        assertThat(differs).isTrue();
    }

    // ========== Void ==========

    @Test
    void voidLeavesChunkEmpty() {
        Chunk chunk = new Chunk(new ChunkPos(0, 0), 16);
        VoidTerrainGenerator.INSTANCE.generate(chunk, SETTINGS);

        assertThat(chunk.entryCount()).isZero();
        assertThat(chunk.revision()).isZero();
    }
}
