package io.liparakis.craftis.world;

/**
 * A single stored voxel inside a chunk, with its packed representation.
 * <p>
 * Coordinates are local to the chunk on the horizontal axes (0 to chunk size - 1)
 * and absolute on the vertical axis.
 * </p>
 * <p>
 * Two packed forms are used by {@link Chunk}:
 * <ul>
 *   <li>Position key ({@code int}): {@code [y: 16 bits signed][x: 8 bits][z: 8 bits]}</li>
 *   <li>Value ({@code long}): {@code [revision: 32 bits][material: 32 bits]}</li>
 * </ul>
 * </p>
 *
 * @param x        local x offset within the chunk
 * @param y        absolute y coordinate
 * @param z        local z offset within the chunk
 * @param material material id, {@link Materials#AIR} for a removed block
 * @param revision chunk revision at which this entry was last written
 * @see Chunk
 */
public record BlockEntry(int x, int y, int z, int material, int revision) {

    /**
     * Largest chunk side length the position key can address.
     */
    public static final int MAX_LOCAL = 256;

    public static final int MIN_Y = Short.MIN_VALUE;
    public static final int MAX_Y = Short.MAX_VALUE;

    public BlockEntry {
        if (x < 0 || x >= MAX_LOCAL) {
            throw new IllegalArgumentException("X offset out of bounds: " + x);
        }
        if (z < 0 || z >= MAX_LOCAL) {
            throw new IllegalArgumentException("Z offset out of bounds: " + z);
        }
        if (y < MIN_Y || y > MAX_Y) {
            throw new IllegalArgumentException("Y coordinate out of bounds: " + y);
        }
    }

    /**
     * Packs a local position into a map key.
     */
    public static int packKey(int x, int y, int z) {
        return ((y & 0xFFFF) << 16) | ((x & 0xFF) << 8) | (z & 0xFF);
    }

    public static int unpackX(int key) {
        return (key >> 8) & 0xFF;
    }

    /**
     * Extracts the sign-extended y coordinate from a position key.
     */
    public static int unpackY(int key) {
        return key >> 16;
    }

    public static int unpackZ(int key) {
        return key & 0xFF;
    }

    /**
     * Packs a material and revision into a map value.
     */
    public static long packValue(int material, int revision) {
        return ((long) revision << 32) | (material & 0xFFFFFFFFL);
    }

    public static int unpackMaterial(long value) {
        return (int) value;
    }

    public static int unpackRevision(long value) {
        return (int) (value >>> 32);
    }

    /**
     * Rebuilds an entry from its packed key and value.
     */
    public static BlockEntry unpack(int key, long value) {
        return new BlockEntry(unpackX(key), unpackY(key), unpackZ(key),
                unpackMaterial(value), unpackRevision(value));
    }

    public int key() {
        return packKey(x, y, z);
    }

    public boolean isAir() {
        return material == Materials.AIR;
    }
}
