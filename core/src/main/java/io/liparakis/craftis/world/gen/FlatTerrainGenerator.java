package io.liparakis.craftis.world.gen;

import io.liparakis.craftis.world.Chunk;
import io.liparakis.craftis.world.WorldSettings;

/**
 * Level ground up to a fixed height.
 */
public final class FlatTerrainGenerator implements TerrainGenerator {
    public static final String NAME = "flat";

    private final int groundLevel;

    public FlatTerrainGenerator(int groundLevel) {
        this.groundLevel = groundLevel;
    }

    @Override
    public void generate(Chunk chunk, WorldSettings settings) {
        if (groundLevel < settings.minY()) {
            return;
        }
        for (int x = 0; x < chunk.size(); x++) {
            for (int z = 0; z < chunk.size(); z++) {
                ColumnFiller.fill(chunk, settings, x, z, groundLevel);
            }
        }
    }

    @Override
    public String name() {
        return NAME;
    }
}
