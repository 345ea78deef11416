package io.liparakis.craftis.server.command;

import io.liparakis.craftis.player.Player;
import io.liparakis.craftis.player.PlayerRegistry;
import io.liparakis.craftis.player.Pose;
import io.liparakis.craftis.protocol.MessageCodec;
import io.liparakis.craftis.world.WorldSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Slash commands typed into chat. A line starting with {@code /} is never
 * broadcast; its output goes to the issuing client only.
 */
public final class ChatCommands {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChatCommands.class);
    public static final char PREFIX = '/';

    private final PlayerRegistry registry;
    private final WorldSettings settings;

    public ChatCommands(PlayerRegistry registry, WorldSettings settings) {
        this.registry = registry;
        this.settings = settings;
    }

    public static boolean isCommand(String text) {
        return !text.isEmpty() && text.charAt(0) == PREFIX;
    }

    public void execute(CommandSource source, String line) {
        String[] parts = line.trim().split("\\s+");
        String command = parts[0].toLowerCase(Locale.ROOT);
        LOGGER.debug("{} ran {}", source.player().name(), line);

        switch (command) {
            case "/list":
                list(source);
                break;
            case "/goto":
                if (parts.length < 2) {
                    source.reply("Usage: /goto <name>");
                } else {
                    goTo(source, parts[1]);
                }
                break;
            case "/spawn":
                source.teleport(registry.spawn());
                source.reply("Teleported to spawn");
                break;
            case "/pq":
                chunk(source, parts);
                break;
            case "/nick":
                nick(source, parts);
                break;
            case "/help":
                source.reply("Commands: /list, /goto <name>, /spawn, /pq <p> <q>, /nick <name>, /help");
                break;
            default:
                source.reply("Unknown command: " + command);
                break;
        }
    }

    private void list(CommandSource source) {
        String names = registry.list().map(Player::name).collect(Collectors.joining(", "));
        source.reply("Players: " + names);
    }

    private void goTo(CommandSource source, String name) {
        Player target = registry.find(name);
        if (target == null) {
            source.reply("Player '" + name + "' not found");
            return;
        }
        source.teleport(target.pose());
        source.reply("Teleported to " + target.name());
    }

    private void chunk(CommandSource source, String[] parts) {
        if (parts.length < 3) {
            source.reply("Usage: /pq <p> <q>");
            return;
        }
        int p;
        int q;
        try {
            p = Integer.parseInt(parts[1]);
            q = Integer.parseInt(parts[2]);
        } catch (NumberFormatException e) {
            source.reply("Usage: /pq <p> <q>");
            return;
        }
        int size = settings.chunkSize();
        Pose current = source.player().pose();
        float x = (float) ((long) p * size + size / 2.0);
        float z = (float) ((long) q * size + size / 2.0);
        source.teleport(new Pose(x, current.y(), z, current.rx(), current.ry()));
        source.reply("Teleported to chunk (" + p + ", " + q + ")");
    }

    private void nick(CommandSource source, String[] parts) {
        if (parts.length < 2) {
            source.reply("Usage: /nick <name>");
            return;
        }
        String name = parts[1];
        if (name.length() > MessageCodec.MAX_NAME_LENGTH || name.indexOf(MessageCodec.SEPARATOR) >= 0) {
            source.reply("Invalid name: " + name);
            return;
        }
        source.rename(name);
    }
}
