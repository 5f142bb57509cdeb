package com.sysmuse.util;

import java.io.IOException;
import java.util.logging.*;

/**
 * Central logging facade for the leadership roster tools.
 * Wraps java.util.logging behind a small static interface so the engine and
 * the hub log the same way without passing loggers around.
 */
public class LoggingUtil {
    public enum ConsoleOutputMode {
        ALL_TO_OUT,
        ALL_TO_ERR,
        SPLIT_SEVERE_TO_ERR
    }

    private static final Logger logger = Logger.getLogger("com.sysmuse.leadership");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;
    private static String logFileName = null;
    private static ConsoleOutputMode consoleOutputMode = ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;

    private static class ConsoleHandler extends StreamHandler {
        ConsoleHandler(java.io.PrintStream stream, Level level) {
            super(stream, new SimpleFormatter());
            setLevel(level);
        }

        @Override
        public synchronized void publish(LogRecord record) {
            super.publish(record);
            flush();
        }
    }

    /**
     * Configure where log messages go in console. Takes effect on the next initialize.
     */
    public static void setConsoleOutputMode(ConsoleOutputMode mode) {
        consoleOutputMode = mode == null ? ConsoleOutputMode.SPLIT_SEVERE_TO_ERR : mode;
    }

    /**
     * Mode by name, case-insensitive; unknown or empty names give {@code SPLIT_SEVERE_TO_ERR}.
     */
    public static ConsoleOutputMode parseConsoleOutputMode(String name) {
        if (name != null) {
            for (ConsoleOutputMode mode : ConsoleOutputMode.values()) {
                if (mode.name().equalsIgnoreCase(name.trim())) {
                    return mode;
                }
            }
        }
        return ConsoleOutputMode.SPLIT_SEVERE_TO_ERR;
    }

    /**
     * Initialize logging. Later calls are ignored until {@link #reset()}.
     *
     * @param levelStr TRACE, DEBUG, INFO, WARNING or SEVERE
     * @param consoleEnabled log to stdout/stderr
     * @param fileEnabled also log to fileName
     * @param fileName log file, ignored when fileEnabled is false
     */
    public static synchronized void initialize(String levelStr, boolean consoleEnabled,
                                               boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = parseLevel(levelStr);
        clearHandlers();

        if (consoleEnabled) {
            setupConsoleHandlers();
        }

        logFileName = null;
        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                logFileName = fileName;
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        debug("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled +
                ", file=" + (logFileName != null ? logFileName : "disabled"));
    }

    /**
     * Drop all handlers so the next call to initialize starts fresh.
     */
    public static synchronized void reset() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
            handler.close();
        }
        initialized = false;
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) {
            return Level.INFO;
        }
        switch (levelStr.trim().toUpperCase()) {
            case "SEVERE":
            case "ERROR":
                return Level.SEVERE;
            case "WARNING":
            case "WARN":
                return Level.WARNING;
            case "DEBUG":
                return Level.FINE;
            case "TRACE":
                return Level.FINEST;
            default:
                return Level.INFO;
        }
    }

    private static void clearHandlers() {
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }
    }

    private static void setupConsoleHandlers() {
        switch (consoleOutputMode) {
            case ALL_TO_OUT:
                logger.addHandler(new ConsoleHandler(System.out, currentLevel));
                break;
            case ALL_TO_ERR:
                logger.addHandler(new ConsoleHandler(System.err, currentLevel));
                break;
            case SPLIT_SEVERE_TO_ERR:
                logger.addHandler(new ConsoleHandler(System.out, currentLevel) {
                    @Override
                    public boolean isLoggable(LogRecord record) {
                        return super.isLoggable(record) && record.getLevel().intValue() < Level.SEVERE.intValue();
                    }
                });
                logger.addHandler(new ConsoleHandler(System.err, Level.SEVERE));
                break;
        }
    }

    public static void trace(String message) {
        ensureInitialized();
        logger.finest(message);
    }

    public static void debug(String message) {
        ensureInitialized();
        logger.fine(message);
    }

    public static void info(String message) {
        ensureInitialized();
        logger.info(message);
    }

    public static void warn(String message) {
        ensureInitialized();
        logger.warning(message);
    }

    public static void error(String message) {
        ensureInitialized();
        logger.severe(message);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, null);
        }
    }
}
