package io.liparakis.craftis.world;

/**
 * Observer of applied edits.
 * <p>
 * Invoked while the owning chunk is still locked, so for any one chunk the
 * notifications arrive in exactly the order the edits were serialized.
 * Implementations must not block.
 * </p>
 */
@FunctionalInterface
public interface WorldListener {
    void blockChanged(BlockChange change);
}
