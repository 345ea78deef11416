package io.liparakis.craftis.world;

/**
 * Material ids understood by Craft clients. The server only validates the
 * numeric range; these names are used by the terrain generators.
 */
public final class Materials {
    public static final int AIR = 0;
    public static final int GRASS = 1;
    public static final int SAND = 2;
    public static final int STONE = 3;
    public static final int BRICK = 4;
    public static final int WOOD = 5;
    public static final int CEMENT = 6;
    public static final int DIRT = 7;
    public static final int PLANK = 8;
    public static final int SNOW = 9;
    public static final int GLASS = 10;
    public static final int COBBLE = 11;

    private Materials() {
        throw new AssertionError("Materials is a utility class and should not be instantiated");
    }
}
