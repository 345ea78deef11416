package io.liparakis.craftis.storage;

import io.liparakis.craftis.world.ChunkPos;
import org.jetbrains.annotations.NotNull;

/**
 * Region coordinate key for caching.
 *
 * @param x the region's X coordinate
 * @param z the region's Z coordinate
 */
record RegionKey(int x, int z) {

    static RegionKey of(ChunkPos pos) {
        return new RegionKey(pos.p() >> StorageConstants.REGION_SHIFT, pos.q() >> StorageConstants.REGION_SHIFT);
    }

    String fileName() {
        return String.format(StorageConstants.REGION_FILE_FORMAT, x, z);
    }

    @Override
    public @NotNull String toString() {
        return "r." + x + "." + z;
    }
}
