package io.liparakis.craftis.player;

/**
 * Thrown when an operation names a player that is no longer registered, for
 * example a message that arrived just after its sender disconnected. Callers
 * are expected to drop the operation.
 */
public class StaleReferenceException extends IllegalStateException {
    private final int playerId;

    public StaleReferenceException(int playerId) {
        super("Player " + playerId + " is not registered");
        this.playerId = playerId;
    }

    public int playerId() {
        return playerId;
    }
}
