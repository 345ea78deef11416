package io.liparakis.craftis.world;

/**
 * Thrown when an edit falls outside the world's vertical bounds or carries a
 * material id the world does not accept. Only the offending edit is rejected.
 */
public class BlockOutOfRangeException extends IllegalArgumentException {

    public BlockOutOfRangeException(String message) {
        super(message);
    }
}
