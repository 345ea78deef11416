package io.liparakis.craftis.player;

/**
 * Immutable view of one live player. The registry replaces the entry on every
 * change instead of mutating it, so a reference handed out earlier never
 * changes under its holder.
 *
 * @param id           player id, unique among live players
 * @param connectionId id of the owning connection
 * @param name         display name
 * @param pose         last reported pose
 */
public record Player(int id, long connectionId, String name, Pose pose) {

    Player withPose(Pose newPose) {
        return new Player(id, connectionId, name, newPose);
    }

    Player withName(String newName) {
        return new Player(id, connectionId, newName, pose);
    }
}
