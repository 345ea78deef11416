package io.liparakis.craftis.storage;

import java.io.IOException;

/**
 * Failure to read or write durable world data. Never fatal: the in-memory
 * world stays authoritative and the write is retried on the next flush.
 */
public class StorageException extends IOException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
