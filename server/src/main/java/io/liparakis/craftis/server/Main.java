package io.liparakis.craftis.server;

import io.liparakis.craftis.server.config.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: {@code craftis-server [config.json]}.
 */
public final class Main {
    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);
    private static final String DEFAULT_CONFIG = "server.json";

    private Main() {
        throw new AssertionError("Main is a utility class and should not be instantiated");
    }

    public static void main(String[] args) {
        Path configPath = Paths.get(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        CraftisServer server;
        try {
            server = new CraftisServer(ServerConfig.load(configPath));
            server.start();
        } catch (Exception e) {
            LOGGER.error("Failed to start server: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "craftis-shutdown"));
    }
}
