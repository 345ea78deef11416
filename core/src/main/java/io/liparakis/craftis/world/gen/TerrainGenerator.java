package io.liparakis.craftis.world.gen;

import io.liparakis.craftis.world.Chunk;
import io.liparakis.craftis.world.WorldSettings;

import java.util.Locale;

/**
 * Fills a freshly created chunk that has no persisted record.
 * <p>
 * Implementations must be deterministic for a given seed: unedited chunks are
 * never written to disk and are regenerated on every load.
 * </p>
 */
public interface TerrainGenerator {

    /**
     * Revision stamped on generated entries, so a client starting from
     * revision 0 receives them.
     */
    int GENERATED_REVISION = 1;

    void generate(Chunk chunk, WorldSettings settings);

    /**
     * Name persisted in the level file.
     */
    String name();

    /**
     * Resolves a generator by its configured name.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    static TerrainGenerator byName(String name, long seed, int groundLevel) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case FlatTerrainGenerator.NAME:
                return new FlatTerrainGenerator(groundLevel);
            case HillsTerrainGenerator.NAME:
                return new HillsTerrainGenerator(seed, groundLevel);
            case VoidTerrainGenerator.NAME:
                return VoidTerrainGenerator.INSTANCE;
            default:
                throw new IllegalArgumentException("Unknown terrain generator: " + name);
        }
    }
}
