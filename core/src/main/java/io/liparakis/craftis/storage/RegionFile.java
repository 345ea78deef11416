package io.liparakis.craftis.storage;

import io.liparakis.craftis.Craftis;
import io.liparakis.craftis.world.ChunkPos;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Region file handler for 32x32 chunks.
 * <p>
 * Layout: an 8 KiB header of (offset, length) int pairs, one per chunk,
 * followed by chunk records. Records are only ever appended; a header entry
 * is swapped to point at a new record after that record has been forced to
 * disk. A crash therefore leaves each header entry pointing either at the old
 * complete record or at the new complete record, never at a partial one.
 * Bytes appended without a matching header entry are dead space, reclaimed by
 * {@link #compact()}.
 * </p>
 */
final class RegionFile implements AutoCloseable {
    private static final int REGION_MASK = 31;
    private static final int CHUNKS_PER_REGION = 1024;
    static final int HEADER_SIZE = 8192;
    private static final int HEADER_ENTRY_SIZE = 8;

    private final RegionKey key;
    private final Path path;
    private FileChannel channel;
    private final int[] offsets = new int[CHUNKS_PER_REGION];
    private final int[] lengths = new int[CHUNKS_PER_REGION];
    private final ByteBuffer headerBuffer = ByteBuffer.allocate(HEADER_ENTRY_SIZE);

    /**
     * Sum of the lengths of every live record.
     */
    private long liveBytes;

    /**
     * Header entries written since the last force.
     */
    private boolean headerDirty;

    /**
     * Guards the reference count and retirement state. Separate from the
     * instance monitor so that acquiring a region never waits on its I/O.
     */
    private final Object lifecycle = new Object();
    private int users;
    private boolean retired;
    private boolean closing;

    /**
     * Opens or creates a region file.
     *
     * @param dir the parent directory
     * @param key the region coordinates
     * @throws IOException if the file cannot be opened
     */
    RegionFile(Path dir, RegionKey key) throws IOException {
        this.key = key;
        this.path = dir.resolve(key.fileName());
        this.channel = open(path);

        try {
            if (channel.size() < HEADER_SIZE) {
                initializeNewRegion();
            } else {
                loadHeader();
            }
        } catch (IOException | RuntimeException e) {
            try {
                channel.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    private static FileChannel open(Path path) throws IOException {
        return FileChannel.open(path,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE,
                StandardOpenOption.CREATE);
    }

    /**
     * Initializes a new region file with an empty header.
     */
    private void initializeNewRegion() throws IOException {
        writeFully(channel, ByteBuffer.allocate(HEADER_SIZE), 0);
        channel.force(true);
    }

    /**
     * Loads the header, dropping entries that point outside the file.
     */
    private void loadHeader() throws IOException {
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
        readFully(header, 0);
        header.flip();

        long size = channel.size();
        liveBytes = 0;
        for (int i = 0; i < CHUNKS_PER_REGION; i++) {
            int offset = header.getInt();
            int length = header.getInt();
            if (offset != 0 && (offset < HEADER_SIZE || length <= 0 || (long) offset + length > size)) {
                Craftis.LOGGER.warn("Region {} entry {} points outside the file ({} + {} > {}) - ignoring",
                        path.getFileName(), i, offset, length, size);
                offset = 0;
                length = 0;
            }
            offsets[i] = offset;
            lengths[i] = offset == 0 ? 0 : length;
            liveBytes += lengths[i];
        }
    }

    /**
     * Reads chunk data from the region file.
     *
     * @param pos the chunk position
     * @return the raw bytes, or {@code null} if the chunk is not present
     * @throws IOException if a read error occurs
     */
    synchronized byte @Nullable [] read(ChunkPos pos) throws IOException {
        int index = getChunkIndex(pos);

        if (offsets[index] == 0) {
            return null;
        }

        ByteBuffer buffer = ByteBuffer.allocate(lengths[index]);
        readFully(buffer, offsets[index]);
        return buffer.array();
    }

    /**
     * Appends a chunk record and points the header at it.
     *
     * @param pos  the chunk position
     * @param data the data to write, or {@code null} to clear the chunk
     * @throws IOException if a write error occurs; the previous record stays
     *                     in effect
     */
    synchronized void write(ChunkPos pos, byte @Nullable [] data) throws IOException {
        int index = getChunkIndex(pos);
        int dataLength = (data == null) ? 0 : data.length;

        int offset = 0;
        if (dataLength > 0) {
            long end = channel.size();
            if (end + dataLength > Integer.MAX_VALUE) {
                throw new StorageException("Region " + path.getFileName() + " is full");
            }
            offset = (int) end;
            writeFully(channel, ByteBuffer.wrap(data), offset);
            // The record must be durable before anything points at it.
            channel.force(false);
        }

        updateHeader(index, offset, dataLength);
        maybeCompact();
    }

    /**
     * Updates the header entry for a chunk in memory and on disk.
     */
    private void updateHeader(int index, int offset, int length) throws IOException {
        liveBytes += length - lengths[index];
        offsets[index] = (length == 0) ? 0 : offset;
        lengths[index] = length;

        headerBuffer.clear();
        headerBuffer.putInt(offsets[index]);
        headerBuffer.putInt(lengths[index]);
        headerBuffer.flip();

        writeFully(channel, headerBuffer, (long) index * HEADER_ENTRY_SIZE);
        headerDirty = true;
    }

    private void maybeCompact() throws IOException {
        long waste = channel.size() - HEADER_SIZE - liveBytes;
        if (waste > StorageConstants.COMPACTION_WASTE_THRESHOLD && waste > liveBytes) {
            compact();
        }
    }

    /**
     * Gets the index of a chunk within the region file header (0-1023).
     */
    private static int getChunkIndex(ChunkPos pos) {
        return (pos.p() & REGION_MASK) + (pos.q() & REGION_MASK) * 32;
    }

    /**
     * Forces pending header updates to disk.
     */
    synchronized void flush() throws IOException {
        if (headerDirty && channel.isOpen()) {
            channel.force(false);
            headerDirty = false;
        }
    }

    /**
     * @return bytes in the file not referenced by any header entry
     */
    synchronized long wastedBytes() throws IOException {
        return channel.size() - HEADER_SIZE - liveBytes;
    }

    Path path() {
        return path;
    }

    RegionKey key() {
        return key;
    }

    // ==================== Lifecycle ====================

    /**
     * Registers a user of this region. A retired region that is not yet
     * closing is revived.
     *
     * @return {@code false} if the region is already closing
     */
    boolean retain() {
        synchronized (lifecycle) {
            if (closing) {
                return false;
            }
            users++;
            retired = false;
            return true;
        }
    }

    /**
     * @return whether the caller released the last use of a retired region
     *         and must now close it
     */
    boolean release() {
        synchronized (lifecycle) {
            if (users <= 0) {
                throw new IllegalStateException("Region " + path.getFileName() + " released more often than retained");
            }
            users--;
            return claimClose();
        }
    }

    /**
     * Marks the region as no longer cached.
     *
     * @return whether the region is unused and the caller must now close it
     */
    boolean retire() {
        synchronized (lifecycle) {
            retired = true;
            return claimClose();
        }
    }

    private boolean claimClose() {
        if (users == 0 && retired && !closing) {
            closing = true;
            return true;
        }
        return false;
    }

    /**
     * Compacts the region file by rewriting live records contiguously into a
     * temporary file and renaming it over the region. A crash before the
     * rename leaves the original untouched.
     */
    synchronized void compact() throws IOException {
        flush();
        Path tempPath = path.resolveSibling(path.getFileName().toString() + ".tmp");

        try (FileChannel dest = FileChannel.open(tempPath, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {

            int currentOffset = HEADER_SIZE;
            ByteBuffer newHeader = ByteBuffer.allocate(HEADER_SIZE);

            for (int i = 0; i < CHUNKS_PER_REGION; i++) {
                if (offsets[i] != 0 && lengths[i] > 0) {
                    ByteBuffer chunkData = ByteBuffer.allocate(lengths[i]);
                    readFully(chunkData, offsets[i]);
                    chunkData.flip();
                    writeFully(dest, chunkData, currentOffset);

                    newHeader.putInt(currentOffset);
                    newHeader.putInt(lengths[i]);
                    currentOffset += lengths[i];
                } else {
                    newHeader.putInt(0);
                    newHeader.putInt(0);
                }
            }

            newHeader.flip();
            writeFully(dest, newHeader, 0);
            dest.force(true);
        }

        // Close current channel to allow swap
        channel.close();
        try {
            try {
                Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            channel = open(path);
            loadHeader();
            headerDirty = false;
        }
        Craftis.LOGGER.debug("Compacted region {} to {} live bytes", path.getFileName(), liveBytes);
    }

    private void readFully(ByteBuffer buffer, long position) throws IOException {
        long at = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, at);
            if (read < 0) {
                throw new StorageException("Unexpected end of region " + path.getFileName() + " at " + at);
            }
            at += read;
        }
    }

    private static void writeFully(FileChannel target, ByteBuffer buffer, long position) throws IOException {
        long at = position;
        while (buffer.hasRemaining()) {
            at += target.write(buffer, at);
        }
    }

    /**
     * Flushes and closes the region file.
     */
    @Override
    public synchronized void close() throws IOException {
        try {
            flush();
        } finally {
            channel.close();
        }
    }
}
