package io.liparakis.craftis.server.net;

import io.liparakis.craftis.player.PlayerRegistry;
import io.liparakis.craftis.protocol.MessageCodec;
import io.liparakis.craftis.server.command.ChatCommands;
import io.liparakis.craftis.server.config.ServerConfig;
import io.liparakis.craftis.world.World;

/**
 * Shared state handed to every connection handler.
 */
public record ServerContext(ServerConfig config, World world, PlayerRegistry registry,
                            Broadcaster broadcaster, MessageCodec codec, ChatCommands commands) {
}
