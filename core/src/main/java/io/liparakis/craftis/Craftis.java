package io.liparakis.craftis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared constants and utilities for Craftis core.
 * Transport-agnostic.
 */
public class Craftis {
    public static final String NAME = "craftis";
    public static final Logger LOGGER = LoggerFactory.getLogger(NAME);

    /**
     * Craft line protocol version spoken by this server.
     */
    public static final int PROTOCOL_VERSION = 1;
}
