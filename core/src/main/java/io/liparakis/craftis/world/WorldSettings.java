package io.liparakis.craftis.world;

/**
 * Immutable geometry and validation limits of a world.
 *
 * @param chunkSize     side length of a chunk in blocks (1 to 256)
 * @param minY          lowest editable y coordinate
 * @param maxY          highest editable y coordinate
 * @param maxMaterialId largest accepted material id
 */
public record WorldSettings(int chunkSize, int minY, int maxY, int maxMaterialId) {

    public static final int DEFAULT_CHUNK_SIZE = 32;
    public static final int DEFAULT_MIN_Y = 0;
    public static final int DEFAULT_MAX_Y = 255;
    public static final int DEFAULT_MAX_MATERIAL_ID = 255;

    public static final WorldSettings DEFAULT = new WorldSettings(
            DEFAULT_CHUNK_SIZE, DEFAULT_MIN_Y, DEFAULT_MAX_Y, DEFAULT_MAX_MATERIAL_ID);

    /**
     * @throws IllegalArgumentException if any limit cannot be represented by
     *                                  the chunk entry packing
     */
    public WorldSettings {
        if (chunkSize < 1 || chunkSize > BlockEntry.MAX_LOCAL) {
            throw new IllegalArgumentException("Chunk size must be within [1, " + BlockEntry.MAX_LOCAL + "]: " + chunkSize);
        }
        if (minY < BlockEntry.MIN_Y || maxY > BlockEntry.MAX_Y || minY > maxY) {
            throw new IllegalArgumentException("Invalid vertical bounds [" + minY + ", " + maxY + "]");
        }
        if (maxMaterialId < 1) {
            throw new IllegalArgumentException("Max material id must be positive: " + maxMaterialId);
        }
    }

    public boolean isInVerticalRange(int y) {
        return y >= minY && y <= maxY;
    }

    public boolean isValidMaterial(int material) {
        return material >= Materials.AIR && material <= maxMaterialId;
    }
}
