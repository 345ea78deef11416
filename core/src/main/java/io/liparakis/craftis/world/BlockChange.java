package io.liparakis.craftis.world;

/**
 * Result of an applied edit, ready for fan-out.
 *
 * @param chunk    owning chunk
 * @param x        world x
 * @param y        world y
 * @param z        world z
 * @param material resulting material id
 * @param revision chunk revision produced by the edit
 */
public record BlockChange(ChunkPos chunk, int x, int y, int z, int material, int revision) {
}
