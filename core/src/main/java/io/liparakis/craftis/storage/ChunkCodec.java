package io.liparakis.craftis.storage;

import io.liparakis.craftis.world.BlockEntry;
import io.liparakis.craftis.world.Chunk;
import io.liparakis.craftis.world.ChunkPos;
import io.liparakis.craftis.world.ChunkSnapshot;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.zip.CRC32;

/**
 * Binary chunk record format, before compression.
 * <p>
 * Layout (big-endian):
 * <pre>
 * int   MAGIC
 * byte  VERSION
 * int   p, q
 * short chunk size
 * int   chunk revision
 * int   entry count
 * per entry: ubyte x, short y, ubyte z, int material, int revision
 * int   CRC32 of everything above
 * </pre>
 * Air tombstones are stored like any other entry so removals survive a
 * restart.
 * </p>
 */
final class ChunkCodec {
    private static final int HEADER_BYTES = 4 + 1 + 4 + 4 + 2 + 4 + 4;
    private static final int ENTRY_BYTES = 1 + 2 + 1 + 4 + 4;
    private static final int CRC_BYTES = 4;

    private ChunkCodec() {
        throw new AssertionError("ChunkCodec is a utility class and should not be instantiated");
    }

    static byte[] encode(ChunkSnapshot snapshot) {
        List<BlockEntry> entries = snapshot.entries();
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(
                HEADER_BYTES + entries.size() * ENTRY_BYTES + CRC_BYTES);

        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeInt(StorageConstants.MAGIC);
            out.writeByte(StorageConstants.VERSION);
            out.writeInt(snapshot.pos().p());
            out.writeInt(snapshot.pos().q());
            out.writeShort(snapshot.chunkSize());
            out.writeInt(snapshot.revision());
            out.writeInt(entries.size());
            for (BlockEntry entry : entries) {
                out.writeByte(entry.x());
                out.writeShort(entry.y());
                out.writeByte(entry.z());
                out.writeInt(entry.material());
                out.writeInt(entry.revision());
            }
        } catch (IOException e) {
            throw new IllegalStateException("In-memory stream failed", e);
        }

        byte[] body = bytes.toByteArray();
        byte[] record = new byte[body.length + CRC_BYTES];
        System.arraycopy(body, 0, record, 0, body.length);
        int crc = checksum(body, body.length);
        record[body.length] = (byte) (crc >>> 24);
        record[body.length + 1] = (byte) (crc >>> 16);
        record[body.length + 2] = (byte) (crc >>> 8);
        record[body.length + 3] = (byte) crc;
        return record;
    }

    /**
     * Restores a chunk from a record.
     *
     * @param expected the position the record was stored under
     * @throws StorageException if the record is truncated, fails its checksum,
     *                          has an unknown version or belongs to another
     *                          chunk
     */
    static Chunk decode(byte[] record, ChunkPos expected) throws StorageException {
        if (record.length < HEADER_BYTES + CRC_BYTES) {
            throw new StorageException("Record for " + expected + " is truncated: " + record.length + " bytes");
        }

        int bodyLength = record.length - CRC_BYTES;
        int storedCrc = ((record[bodyLength] & 0xFF) << 24)
                | ((record[bodyLength + 1] & 0xFF) << 16)
                | ((record[bodyLength + 2] & 0xFF) << 8)
                | (record[bodyLength + 3] & 0xFF);
        if (storedCrc != checksum(record, bodyLength)) {
            throw new StorageException("Checksum mismatch in record for " + expected);
        }

        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(record, 0, bodyLength))) {
            int magic = in.readInt();
            if (magic != StorageConstants.MAGIC) {
                throw new StorageException("Bad magic 0x" + Integer.toHexString(magic) + " in record for " + expected);
            }
            int version = in.readUnsignedByte();
            if (version != StorageConstants.VERSION) {
                throw new StorageException("Unsupported record version " + version + " for " + expected);
            }
            ChunkPos pos = new ChunkPos(in.readInt(), in.readInt());
            if (!pos.equals(expected)) {
                throw new StorageException("Record for " + expected + " holds chunk " + pos);
            }
            int size = in.readUnsignedShort();
            int revision = in.readInt();
            int count = in.readInt();
            if (count < 0 || (long) count * ENTRY_BYTES != bodyLength - HEADER_BYTES) {
                throw new StorageException("Entry count " + count + " does not match record length for " + expected);
            }

            Chunk chunk = new Chunk(pos, size);
            for (int i = 0; i < count; i++) {
                int x = in.readUnsignedByte();
                int y = in.readShort();
                int z = in.readUnsignedByte();
                int material = in.readInt();
                int entryRevision = in.readInt();
                chunk.restore(x, y, z, material, entryRevision);
            }
            chunk.restoreRevision(revision);
            return chunk;
        } catch (StorageException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw new StorageException("Malformed record for " + expected, e);
        }
    }

    private static int checksum(byte[] data, int length) {
        CRC32 crc = new CRC32();
        crc.update(data, 0, length);
        return (int) crc.getValue();
    }
}
