package org.matchreminder;

import org.matchreminder.config.BotConfig;
import org.matchreminder.exception.ConfigurationMissingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        BotConfig config;
        try {
            config = BotConfig.load(System.getenv());
        } catch (ConfigurationMissingException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        ServiceContext context;
        try {
            context = ServiceContext.create(config);
        } catch (RuntimeException e) {
            log.error("Could not build the bot from its configuration", e);
            System.exit(1);
            return;
        }
        Runtime.getRuntime().addShutdownHook(new Thread(context::close, "shutdown"));
        try {
            context.start();
        } catch (Exception e) {
            log.error("Startup failed", e);
            context.close();
            System.exit(1);
        }
    }
}
