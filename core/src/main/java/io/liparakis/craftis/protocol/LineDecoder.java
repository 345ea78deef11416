package io.liparakis.craftis.protocol;

import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Splits a raw byte stream into newline-terminated records.
 * <p>
 * Bytes are appended with {@link #feed}; each {@link #next()} call returns at
 * most one complete record. A record split across several socket reads stays
 * buffered until its terminator arrives. A trailing {@code '\r'} is dropped so
 * CRLF peers work too.
 * </p>
 * <p>
 * Not thread-safe; each connection owns one decoder.
 * </p>
 */
public final class LineDecoder {
    public static final int DEFAULT_MAX_RECORD_LENGTH = 4096;
    private static final int INITIAL_CAPACITY = 512;

    private final int maxRecordLength;
    private byte[] buffer = new byte[INITIAL_CAPACITY];

    /**
     * Start of the first unconsumed byte.
     */
    private int start;

    /**
     * One past the last buffered byte.
     */
    private int end;

    /**
     * Position from which the terminator search resumes, so bytes already
     * scanned are not scanned again.
     */
    private int scan;

    public LineDecoder(int maxRecordLength) {
        if (maxRecordLength < 1) {
            throw new IllegalArgumentException("Max record length must be positive: " + maxRecordLength);
        }
        this.maxRecordLength = maxRecordLength;
    }

    public LineDecoder() {
        this(DEFAULT_MAX_RECORD_LENGTH);
    }

    /**
     * Appends raw bytes received from the peer.
     */
    public void feed(byte[] data, int offset, int length) {
        ensureCapacity(length);
        System.arraycopy(data, offset, buffer, end, length);
        end += length;
    }

    /**
     * Extracts the next complete record.
     *
     * @return the record without terminator, or {@code null} if no complete
     *         record is buffered
     * @throws ProtocolException if a record exceeds the maximum length
     */
    public @Nullable String next() throws ProtocolException {
        for (int i = scan; i < end; i++) {
            if (buffer[i] == MessageCodec.TERMINATOR) {
                int recordEnd = i;
                if (recordEnd > start && buffer[recordEnd - 1] == '\r') {
                    recordEnd--;
                }
                String record = new String(buffer, start, recordEnd - start, StandardCharsets.UTF_8);
                if (recordEnd - start > maxRecordLength) {
                    throw new ProtocolException(record, "Record exceeds " + maxRecordLength + " bytes");
                }
                start = i + 1;
                scan = start;
                return record;
            }
        }

        scan = end;
        if (end - start > maxRecordLength) {
            String partial = new String(buffer, start, Math.min(end - start, maxRecordLength), StandardCharsets.UTF_8);
            throw new ProtocolException(partial, "Unterminated record exceeds " + maxRecordLength + " bytes");
        }
        return null;
    }

    /**
     * @return number of buffered bytes not yet returned as a record
     */
    public int pending() {
        return end - start;
    }

    private void ensureCapacity(int extra) {
        if (end + extra <= buffer.length) {
            return;
        }

        int pending = end - start;
        if (pending + extra <= buffer.length) {
            System.arraycopy(buffer, start, buffer, 0, pending);
        } else {
            int capacity = buffer.length;
            while (capacity < pending + extra) {
                capacity <<= 1;
            }
            byte[] grown = Arrays.copyOf(Arrays.copyOfRange(buffer, start, end), capacity);
            buffer = grown;
        }
        scan -= start;
        end = pending;
        start = 0;
    }
}
