package io.liparakis.craftis.storage;

import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * Per-thread DEFLATE state for chunk records.
 * <p>
 * One instance is owned by a single thread (see {@link ChunkStorage}), so
 * the native deflater and inflater are reused across records without
 * locking. Output is grown in place rather than through a stream.
 * </p>
 */
final class CompressionContext {
    private static final int MIN_OUTPUT = 256;

    private final Deflater deflater = new Deflater(StorageConstants.COMPRESSION_LEVEL);
    private final Inflater inflater = new Inflater();
    private final int maxInflatedBytes;

    CompressionContext() {
        this(StorageConstants.MAX_RECORD_BYTES);
    }

    CompressionContext(int maxInflatedBytes) {
        this.maxInflatedBytes = maxInflatedBytes;
    }

    byte[] compress(byte[] record) {
        deflater.reset();
        deflater.setInput(record);
        deflater.finish();

        // Chunk records are repetitive; a quarter of the input is a good first guess.
        byte[] out = new byte[Math.max(MIN_OUTPUT, record.length / 4)];
        int written = 0;
        while (!deflater.finished()) {
            if (written == out.length) {
                out = Arrays.copyOf(out, out.length * 2);
            }
            written += deflater.deflate(out, written, out.length - written);
        }
        return Arrays.copyOf(out, written);
    }

    /**
     * @throws StorageException if the stream is truncated, malformed or
     *                          inflates past the record size limit
     */
    byte[] decompress(byte[] compressed) throws StorageException {
        inflater.reset();
        inflater.setInput(compressed);

        byte[] out = new byte[Math.max(MIN_OUTPUT, compressed.length * 4)];
        int written = 0;
        try {
            while (!inflater.finished()) {
                if (written == out.length) {
                    if (out.length >= maxInflatedBytes) {
                        throw new StorageException("Record inflates past " + maxInflatedBytes + " bytes");
                    }
                    out = Arrays.copyOf(out, (int) Math.min((long) out.length * 2, maxInflatedBytes));
                }
                int inflated = inflater.inflate(out, written, out.length - written);
                if (inflated == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new StorageException("Compressed record is truncated");
                }
                written += inflated;
            }
        } catch (DataFormatException e) {
            throw new StorageException("Malformed compressed record", e);
        }
        return Arrays.copyOf(out, written);
    }
}
