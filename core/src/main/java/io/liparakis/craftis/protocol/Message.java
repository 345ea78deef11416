package io.liparakis.craftis.protocol;

/**
 * A typed protocol record.
 */
public interface Message {

    Opcode opcode();

    /**
     * Appends every field after the opcode, in wire order.
     */
    void writeFields(RecordWriter out);
}
