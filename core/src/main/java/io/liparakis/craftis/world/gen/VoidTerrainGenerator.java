package io.liparakis.craftis.world.gen;

import io.liparakis.craftis.world.Chunk;
import io.liparakis.craftis.world.WorldSettings;

/**
 * Leaves every chunk empty.
 */
public final class VoidTerrainGenerator implements TerrainGenerator {
    public static final String NAME = "void";
    public static final VoidTerrainGenerator INSTANCE = new VoidTerrainGenerator();

    private VoidTerrainGenerator() {
    }

    @Override
    public void generate(Chunk chunk, WorldSettings settings) {
    }

    @Override
    public String name() {
        return NAME;
    }
}
