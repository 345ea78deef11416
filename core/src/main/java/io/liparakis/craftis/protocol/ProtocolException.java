package io.liparakis.craftis.protocol;

import java.io.IOException;

/**
 * Thrown when a peer sends a record that cannot be decoded. The connection
 * that produced it is closed; nothing it sent is applied.
 */
public class ProtocolException extends IOException {
    private static final int MAX_QUOTED_LENGTH = 64;

    private final String record;

    public ProtocolException(String record, String reason) {
        super(reason + ": \"" + quote(record) + "\"");
        this.record = record;
    }

    /**
     * @return the offending record, as received
     */
    public String record() {
        return record;
    }

    private static String quote(String record) {
        if (record.length() <= MAX_QUOTED_LENGTH) {
            return record;
        }
        return record.substring(0, MAX_QUOTED_LENGTH) + "...";
    }
}
