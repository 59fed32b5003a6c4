package org.cadsync.console.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Root logger setup for the console process.
 */
public final class LoggingSetup {

    private static final Logger LOG = Logger.getLogger(LoggingSetup.class.getName());

    private static final int MAX_FILE_BYTES = 5 * 1024 * 1024;
    private static final int FILE_COUNT = 3;

    private LoggingSetup() {
    }

    /**
     * Configure file logging if enabled.
     *
     * @return the installed file handler, or null when file logging is off or could not be set up
     */
    public static Handler configure(ConsoleConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return null;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), MAX_FILE_BYTES, FILE_COUNT, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
            return handler;
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
            return null;
        }
    }
}
