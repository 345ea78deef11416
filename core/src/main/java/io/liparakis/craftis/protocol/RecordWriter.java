package io.liparakis.craftis.protocol;

/**
 * Builds one comma-separated record.
 */
public final class RecordWriter {
    private final StringBuilder builder;

    RecordWriter(Opcode opcode) {
        this.builder = new StringBuilder(32).append(opcode.code());
    }

    public RecordWriter add(int value) {
        builder.append(MessageCodec.SEPARATOR).append(value);
        return this;
    }

    public RecordWriter add(long value) {
        builder.append(MessageCodec.SEPARATOR).append(value);
        return this;
    }

    public RecordWriter add(float value) {
        builder.append(MessageCodec.SEPARATOR).append(value);
        return this;
    }

    /**
     * Appends free text. Line terminators would split the record, so they are
     * replaced with spaces.
     */
    public RecordWriter add(String value) {
        builder.append(MessageCodec.SEPARATOR);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            builder.append(c == '\n' || c == '\r' ? ' ' : c);
        }
        return this;
    }

    @Override
    public String toString() {
        return builder.toString();
    }
}
