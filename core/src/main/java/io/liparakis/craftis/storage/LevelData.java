package io.liparakis.craftis.storage;

import io.liparakis.craftis.world.WorldSettings;

/**
 * World-wide parameters persisted in {@code level.json}. Once a world has
 * been created these win over the server configuration, so terrain that was
 * never stored regenerates identically.
 *
 * @param formatVersion layout version of the level file
 * @param seed          terrain seed
 * @param generator     terrain generator name
 * @param groundLevel   ground height passed to the generator
 * @param chunkSize     chunk side length; must match the running server
 * @param minY          lowest editable y
 * @param maxY          highest editable y
 * @param maxMaterialId largest accepted material id
 */
public record LevelData(int formatVersion, long seed, String generator, int groundLevel,
                        int chunkSize, int minY, int maxY, int maxMaterialId) {

    public static LevelData of(WorldSettings settings, String generator, long seed, int groundLevel) {
        return new LevelData(StorageConstants.LEVEL_FORMAT_VERSION, seed, generator, groundLevel,
                settings.chunkSize(), settings.minY(), settings.maxY(), settings.maxMaterialId());
    }

    public WorldSettings settings() {
        return new WorldSettings(chunkSize, minY, maxY, maxMaterialId);
    }

    LevelData withFormatVersion(int version) {
        return new LevelData(version, seed, generator, groundLevel, chunkSize, minY, maxY, maxMaterialId);
    }
}
