package io.liparakis.craftis.protocol;

import io.liparakis.craftis.player.Pose;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Converts between protocol records and typed messages.
 * <p>
 * Decoding validates the whole record once (opcode, field count, numeric
 * fields, names) and either returns a fully typed message or throws
 * {@link ProtocolException}; nothing partially decoded ever escapes. Encoding
 * is infallible for well-formed messages.
 * </p>
 * <p>
 * Stateless and thread-safe.
 * </p>
 */
public final class MessageCodec {
    public static final char SEPARATOR = ',';
    public static final char TERMINATOR = '\n';

    /**
     * Longest display name accepted, in characters.
     */
    public static final int MAX_NAME_LENGTH = 32;

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d{1,10}");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d{1,3})?");

    // ==================== Encoding ====================

    /**
     * @return the record text, without terminator
     */
    public String encode(Message message) {
        RecordWriter out = new RecordWriter(message.opcode());
        message.writeFields(out);
        return out.toString();
    }

    /**
     * @return the terminated record as wire bytes
     */
    public byte[] toWire(Message message) {
        return (encode(message) + TERMINATOR).getBytes(StandardCharsets.UTF_8);
    }

    // ==================== Decoding ====================

    /**
     * Decodes a record received by the server.
     *
     * @param record one record, without terminator
     * @throws ProtocolException if the record is malformed or is not a
     *                           client-to-server record
     */
    public ClientMessage decodeClient(String record) throws ProtocolException {
        Fields fields = new Fields(record);
        Opcode opcode = fields.opcode();

        switch (opcode) {
            case VERSION:
                fields.expectCount(2);
                return new ClientMessage.Version(fields.intAt(1));
            case AUTHENTICATE:
                fields.expectCount(3);
                return new ClientMessage.Authenticate(fields.nameAt(1), fields.textAt(2));
            case NICK:
                fields.expectCount(2);
                return new ClientMessage.Nick(fields.nameAt(1));
            case CHUNK:
                if (fields.count() == 3) {
                    return new ClientMessage.ChunkRequest(fields.intAt(1), fields.intAt(2), 0);
                }
                fields.expectCount(4);
                return new ClientMessage.ChunkRequest(fields.intAt(1), fields.intAt(2), fields.intAt(3));
            case BLOCK:
                if (fields.count() == 7) {
                    // Long form carries p,q first; validated but recomputed by the world.
                    fields.intAt(1);
                    fields.intAt(2);
                    return new ClientMessage.BlockEdit(fields.intAt(3), fields.intAt(4), fields.intAt(5), fields.intAt(6));
                }
                fields.expectCount(5);
                return new ClientMessage.BlockEdit(fields.intAt(1), fields.intAt(2), fields.intAt(3), fields.intAt(4));
            case POSITION:
                fields.expectCount(6);
                return new ClientMessage.Position(fields.poseAt(1));
            case TALK:
                return new ClientMessage.Talk(fields.remainderFrom(1));
            case DISCONNECT:
                fields.expectCount(1);
                return new ClientMessage.Disconnect();
            default:
                throw new ProtocolException(record, "Opcode " + opcode.code() + " is not accepted from clients");
        }
    }

    /**
     * Decodes a record received by a client.
     *
     * @param record one record, without terminator
     * @throws ProtocolException if the record is malformed or is not a
     *                           server-to-client record
     */
    public ServerMessage decodeServer(String record) throws ProtocolException {
        Fields fields = new Fields(record);
        Opcode opcode = fields.opcode();

        switch (opcode) {
            case YOU:
                fields.expectCount(7);
                return new ServerMessage.You(fields.intAt(1), fields.poseAt(2));
            case POSITION:
                fields.expectCount(7);
                return new ServerMessage.PlayerPosition(fields.intAt(1), fields.poseAt(2));
            case BLOCK:
                fields.expectCount(7);
                return new ServerMessage.BlockUpdate(fields.intAt(1), fields.intAt(2),
                        fields.intAt(3), fields.intAt(4), fields.intAt(5), fields.intAt(6));
            case KEY:
                fields.expectCount(4);
                return new ServerMessage.ChunkKey(fields.intAt(1), fields.intAt(2), fields.intAt(3));
            case REDRAW:
                fields.expectCount(3);
                return new ServerMessage.Redraw(fields.intAt(1), fields.intAt(2));
            case TALK:
                return new ServerMessage.Talk(fields.remainderFrom(1));
            case NICK:
                fields.expectCount(3);
                return new ServerMessage.PlayerName(fields.intAt(1), fields.nameAt(2));
            case DISCONNECT:
                fields.expectCount(2);
                return new ServerMessage.PlayerLeft(fields.intAt(1));
            case TIME:
                fields.expectCount(3);
                return new ServerMessage.Time(fields.longAt(1), fields.intAt(2));
            default:
                throw new ProtocolException(record, "Opcode " + opcode.code() + " is not sent by servers");
        }
    }

    /**
     * One split record with typed, validating accessors.
     */
    private static final class Fields {
        private final String record;
        private final String[] parts;

        Fields(String record) throws ProtocolException {
            if (record.isEmpty()) {
                throw new ProtocolException(record, "Empty record");
            }
            this.record = record;
            this.parts = record.split(String.valueOf(SEPARATOR), -1);
        }

        Opcode opcode() throws ProtocolException {
            Opcode opcode = Opcode.fromToken(parts[0]);
            if (opcode == null) {
                throw new ProtocolException(record, "Unknown opcode");
            }
            return opcode;
        }

        int count() {
            return parts.length;
        }

        void expectCount(int expected) throws ProtocolException {
            if (parts.length != expected) {
                throw new ProtocolException(record,
                        "Expected " + expected + " fields but found " + parts.length);
            }
        }

        int intAt(int index) throws ProtocolException {
            String field = parts[index];
            if (!INTEGER.matcher(field).matches()) {
                throw new ProtocolException(record, "Field " + index + " is not an integer");
            }
            try {
                return Integer.parseInt(field);
            } catch (NumberFormatException e) {
                throw new ProtocolException(record, "Field " + index + " overflows an int");
            }
        }

        long longAt(int index) throws ProtocolException {
            String field = parts[index];
            if (!DECIMAL.matcher(field).matches()) {
                throw new ProtocolException(record, "Field " + index + " is not a number");
            }
            return (long) Double.parseDouble(field);
        }

        float floatAt(int index) throws ProtocolException {
            String field = parts[index];
            if (!DECIMAL.matcher(field).matches()) {
                throw new ProtocolException(record, "Field " + index + " is not a number");
            }
            float value = Float.parseFloat(field);
            if (!Float.isFinite(value)) {
                throw new ProtocolException(record, "Field " + index + " is not finite");
            }
            return value;
        }

        Pose poseAt(int index) throws ProtocolException {
            return new Pose(floatAt(index), floatAt(index + 1), floatAt(index + 2),
                    floatAt(index + 3), floatAt(index + 4));
        }

        String textAt(int index) {
            return parts[index];
        }

        String nameAt(int index) throws ProtocolException {
            String name = parts[index].trim();
            if (name.isEmpty()) {
                throw new ProtocolException(record, "Empty name");
            }
            if (name.length() > MAX_NAME_LENGTH) {
                throw new ProtocolException(record, "Name longer than " + MAX_NAME_LENGTH + " characters");
            }
            return name;
        }

        /**
         * Everything after the first {@code index} separators, commas included.
         */
        String remainderFrom(int index) throws ProtocolException {
            if (parts.length <= index) {
                throw new ProtocolException(record, "Missing text field");
            }
            int offset = 0;
            for (int i = 0; i < index; i++) {
                offset += parts[i].length() + 1;
            }
            return record.substring(offset);
        }
    }
}
