package io.liveprobe.server;

import io.liveprobe.core.config.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * java.util.logging bootstrap: loads /logging.properties from the classpath
 * and applies the configured root level.
 */
public final class LoggingSetup {

    private LoggingSetup() {
        // utility
    }

    public static void configure(Level level) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("[logging] failed to read logging.properties: " + e.getMessage());
        }
        Logger.getLogger("").setLevel(level);
        Logger.getLogger("io.liveprobe").setLevel(level);
    }

    /**
     * Accepts the common names (DEBUG, INFO, WARN/WARNING, ERROR, CRITICAL)
     * as well as java.util.logging names (FINE, SEVERE, ...).
     */
    public static Level parseLevel(String name) {
        if (name == null || name.isBlank()) {
            return Level.INFO;
        }
        String n = name.trim().toUpperCase(Locale.ROOT);
        return switch (n) {
            case "TRACE" -> Level.FINEST;
            case "DEBUG" -> Level.FINE;
            case "WARN" -> Level.WARNING;
            case "ERROR", "CRITICAL", "FATAL" -> Level.SEVERE;
            default -> {
                try {
                    yield Level.parse(n);
                } catch (IllegalArgumentException e) {
                    throw new ConfigurationException("Unknown log level: " + name, e);
                }
            }
        };
    }
}
