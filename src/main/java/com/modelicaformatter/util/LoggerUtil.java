package com.modelicaformatter.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Hands out java.util.logging loggers for the formatter's classes. The first call reads
 * {@code /logging.properties} from the classpath; without it, console output and an appending
 * log file are configured. The file defaults to {@code modelica-formatter.log} and can be moved
 * with the {@code modelica.formatter.logFile} system property.
 */
public final class LoggerUtil {
    static final String BASE_LOGGER = "com.modelicaformatter";
    static final String LOG_CONFIG_RESOURCE = "/logging.properties";
    static final String LOG_FILE_PROPERTY = "modelica.formatter.logFile";
    static final String DEFAULT_LOG_FILE = "modelica-formatter.log";

    private static final Logger rootLogger = Logger.getLogger("");
    private static volatile boolean initialized = false;

    private LoggerUtil() {
    }

    public static Logger getLogger(Class<?> clazz) {
        _ensureInitialized();
        return Logger.getLogger(clazz.getName());
    }

    /**
     * Lowers (or raises) the level of the formatter's own loggers and of every console handler.
     * The CLI calls this with {@link Level#FINE} for {@code --verbose}, which makes the
     * indentation engine's per-line decisions visible.
     */
    public static synchronized void setConsoleLevel(Level level) {
        _ensureInitialized();
        Logger.getLogger(BASE_LOGGER).setLevel(level);
        for (Handler handler : rootLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                handler.setLevel(level);
            }
        }
    }

    /**
     * Flushes and closes the root handlers. Called once when the CLI exits.
     */
    public static synchronized void shutdown() {
        for (Handler handler : rootLogger.getHandlers()) {
            handler.flush();
            handler.close();
        }
    }

    static synchronized boolean isInitialized() {
        return initialized;
    }

    private static synchronized void _ensureInitialized() {
        if (initialized) {
            return;
        }
        initialized = true;

        try (InputStream is = LoggerUtil.class.getResourceAsStream(LOG_CONFIG_RESOURCE)) {
            if (is != null) {
                LogManager.getLogManager().readConfiguration(is);
                return;
            }
        } catch (IOException e) {
            System.err.println("Failed to read " + LOG_CONFIG_RESOURCE + ": " + e.getMessage());
        }
        _configureFallback();
    }

    private static void _configureFallback() {
        for (Handler handler : rootLogger.getHandlers()) {
            rootLogger.removeHandler(handler);
        }

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(Level.WARNING);
        consoleHandler.setFormatter(new SimpleFormatter());
        rootLogger.addHandler(consoleHandler);

        String logFile = System.getProperty(LOG_FILE_PROPERTY, DEFAULT_LOG_FILE);
        try {
            FileHandler fileHandler = new FileHandler(logFile, true);
            fileHandler.setLevel(Level.ALL);
            fileHandler.setFormatter(new SimpleFormatter());
            rootLogger.addHandler(fileHandler);
        } catch (IOException e) {
            // console logging still works without the file
            rootLogger.log(Level.WARNING, "Could not open log file " + logFile, e);
        }

        rootLogger.setLevel(Level.INFO);
        Logger.getLogger(BASE_LOGGER).setLevel(Level.INFO);
    }
}
