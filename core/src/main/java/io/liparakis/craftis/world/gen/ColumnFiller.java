package io.liparakis.craftis.world.gen;

import io.liparakis.craftis.world.Chunk;
import io.liparakis.craftis.world.Materials;
import io.liparakis.craftis.world.WorldSettings;

/**
 * Shared column layering: stone, three layers of dirt, grass on top.
 */
final class ColumnFiller {
    private static final int DIRT_DEPTH = 3;

    private ColumnFiller() {
    }

    static void fill(Chunk chunk, WorldSettings settings, int x, int z, int height) {
        int top = Math.min(height, settings.maxY());
        for (int y = settings.minY(); y <= top; y++) {
            int material;
            if (y == top) {
                material = Materials.GRASS;
            } else if (y >= top - DIRT_DEPTH) {
                material = Materials.DIRT;
            } else {
                material = Materials.STONE;
            }
            chunk.restore(x, y, z, material, TerrainGenerator.GENERATED_REVISION);
        }
    }
}
