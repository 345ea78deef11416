package io.liparakis.craftis.player;

/**
 * Position and orientation of a player.
 *
 * @param x  world x
 * @param y  world y
 * @param z  world z
 * @param rx horizontal view angle in radians
 * @param ry vertical view angle in radians
 */
public record Pose(float x, float y, float z, float rx, float ry) {

    public static final Pose ORIGIN = new Pose(0, 0, 0, 0, 0);

    public Pose {
        if (!Float.isFinite(x) || !Float.isFinite(y) || !Float.isFinite(z)
                || !Float.isFinite(rx) || !Float.isFinite(ry)) {
            throw new IllegalArgumentException("Pose components must be finite");
        }
    }
}
