package io.liparakis.craftis.storage;

/**
 * Central constants for the region storage format.
 * <p>
 * This class provides:
 * - Record format constants (magic number, version)
 * - Region geometry
 * - Cache and compaction limits
 */
public final class StorageConstants {

    // ==================== Record Format ====================

    /**
     * Magic number of a chunk record: "CRA1" in ASCII.
     * Used to validate records and detect corruption.
     */
    public static final int MAGIC = 0x43524131;

    /**
     * Current chunk record version.
     * Increment when making breaking changes to the serialization format.
     */
    public static final int VERSION = 1;

    /**
     * Version of the level.json layout.
     */
    public static final int LEVEL_FORMAT_VERSION = 1;

    // ==================== Region Geometry ====================

    /**
     * Regions span 32x32 chunks.
     */
    public static final int REGION_SHIFT = 5;

    public static final String REGION_FILE_FORMAT = "r.%d.%d.cra";

    public static final String LEVEL_FILE_NAME = "level.json";

    // ==================== Storage Limits ====================

    /**
     * Deflate level for chunk records (Deflater.BEST_SPEED).
     */
    public static final int COMPRESSION_LEVEL = 1;

    /**
     * Maximum open region files; the least recently used one is closed when
     * the cache is full.
     */
    public static final int MAX_CACHED_REGIONS = 64;

    /**
     * Dead bytes a region may accumulate from superseded records before it is
     * compacted during a write.
     */
    public static final long COMPACTION_WASTE_THRESHOLD = 1L << 20;

    /**
     * Largest inflated chunk record accepted on load. A 256x256 chunk with
     * 256 filled layers stays well below it.
     */
    public static final int MAX_RECORD_BYTES = 256 << 20;

    private StorageConstants() {
        throw new AssertionError("StorageConstants is a utility class and should not be instantiated");
    }
}
