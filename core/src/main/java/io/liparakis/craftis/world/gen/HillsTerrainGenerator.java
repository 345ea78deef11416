package io.liparakis.craftis.world.gen;

import io.liparakis.craftis.world.Chunk;
import io.liparakis.craftis.world.WorldSettings;

/**
 * Rolling hills from two octaves of hashed value noise.
 */
public final class HillsTerrainGenerator implements TerrainGenerator {
    public static final String NAME = "hills";

    private static final double BASE_FREQUENCY = 0.02;
    private static final double DETAIL_FREQUENCY = 0.1;
    private static final int BASE_AMPLITUDE = 12;
    private static final int DETAIL_AMPLITUDE = 3;

    private final long seed;
    private final int groundLevel;

    public HillsTerrainGenerator(long seed, int groundLevel) {
        this.seed = seed;
        this.groundLevel = groundLevel;
    }

    @Override
    public void generate(Chunk chunk, WorldSettings settings) {
        int size = chunk.size();
        for (int x = 0; x < size; x++) {
            for (int z = 0; z < size; z++) {
                int wx = chunk.pos().blockX(x, size);
                int wz = chunk.pos().blockZ(z, size);
                int height = heightAt(wx, wz);
                if (height >= settings.minY()) {
                    ColumnFiller.fill(chunk, settings, x, z, height);
                }
            }
        }
    }

    /**
     * Surface height of a world column.
     */
    public int heightAt(int x, int z) {
        double base = smoothNoise(x * BASE_FREQUENCY, z * BASE_FREQUENCY);
        double detail = smoothNoise(x * DETAIL_FREQUENCY, z * DETAIL_FREQUENCY);
        return groundLevel + (int) Math.round(BASE_AMPLITUDE * base + DETAIL_AMPLITUDE * detail);
    }

    /**
     * Bilinearly interpolated lattice noise in [-1, 1].
     */
    private double smoothNoise(double x, double z) {
        int x0 = (int) Math.floor(x);
        int z0 = (int) Math.floor(z);
        double fx = fade(x - x0);
        double fz = fade(z - z0);

        double a = lattice(x0, z0);
        double b = lattice(x0 + 1, z0);
        double c = lattice(x0, z0 + 1);
        double d = lattice(x0 + 1, z0 + 1);

        double top = a + (b - a) * fx;
        double bottom = c + (d - c) * fx;
        return top + (bottom - top) * fz;
    }

    private double lattice(int x, int z) {
        long n = x * 49632L ^ z * 325176L ^ seed ^ 0x9E3779B97F4A7C15L;
        n = (n << 13) ^ n;
        long nn = n * (n * n * 15731L + 789221L) + 1376312589L;
        return 1.0 - ((nn & 0x7fffffffL) / 1073741824.0);
    }

    private static double fade(double t) {
        return t * t * (3 - 2 * t);
    }

    @Override
    public String name() {
        return NAME;
    }
}
