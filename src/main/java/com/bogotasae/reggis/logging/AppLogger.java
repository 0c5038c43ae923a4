package com.bogotasae.reggis.logging;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.StreamHandler;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Provides a shared logger configuration for the exporter.
 */
public final class AppLogger {
    private static final String LEVEL_PROPERTY = "reggis.logLevel";
    private static final String LOG_DIR_PROPERTY = "reggis.logDir";

    private static final Logger LOGGER = createLogger();

    private AppLogger() {
    }

    public static Logger get() {
        return LOGGER;
    }

    private static Logger createLogger() {
        Logger logger = Logger.getLogger("com.bogotasae.reggis.ReggisExporter");
        logger.setUseParentHandlers(false);
        Formatter formatter = new Formatter() {
            @Override
            public String format(LogRecord record) {
                String line = "%s %s%n".formatted(record.getLevel().getName(), formatMessage(record));
                if (record.getThrown() != null) {
                    line += "  caused by " + record.getThrown() + System.lineSeparator();
                }
                return line;
            }
        };

        StreamHandler consoleHandler = new StreamHandler(System.out, formatter) {
            @Override
            public synchronized void publish(LogRecord record) {
                super.publish(record);
                flush();
            }
        };
        try {
            consoleHandler.setEncoding(UTF_8.name());
        } catch (Exception ignored) {
            // fall back to platform default when UTF-8 is unavailable
        }
        Level level = resolveLevel(System.getProperty(LEVEL_PROPERTY));
        consoleHandler.setLevel(Level.ALL);
        logger.addHandler(consoleHandler);
        logger.setLevel(level);

        String logDir = System.getProperty(LOG_DIR_PROPERTY);
        if (logDir != null && !logDir.isBlank()) {
            try {
                Path dir = Path.of(logDir.trim());
                Files.createDirectories(dir);
                FileHandler fileHandler = new FileHandler(dir.resolve("reggis-%g.log").toString(), 5_000_000, 3, true);
                fileHandler.setEncoding(UTF_8.name());
                fileHandler.setFormatter(formatter);
                fileHandler.setLevel(Level.ALL);
                logger.addHandler(fileHandler);
            } catch (IOException | RuntimeException ex) {
                logger.warning("File logging disabled: " + ex.getMessage());
            }
        }
        return logger;
    }

    private static Level resolveLevel(String raw) {
        if (raw == null || raw.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(raw.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return Level.INFO;
        }
    }
}
