package io.liparakis.craftis.server.command;

import io.liparakis.craftis.player.Player;
import io.liparakis.craftis.player.Pose;

/**
 * The connection a chat command was typed on.
 */
public interface CommandSource {

    /**
     * @return the issuing player's current state
     */
    Player player();

    /**
     * Sends a chat line to the issuing client only.
     */
    void reply(String text);

    /**
     * Moves the issuing player and tells every client about it.
     */
    void teleport(Pose pose);

    /**
     * Changes the issuing player's display name and announces it.
     */
    void rename(String name);
}
