package com.sysmuse.structure.util;

import com.sysmuse.structure.configuration.AnalyzerConfig;

import java.io.IOException;
import java.util.logging.*;

/**
 * Centralized logging for the structure analyzer.
 * Thin static wrapper around java.util.logging with console and optional file output.
 */
public class LoggingUtil {

    private static final Logger logger = Logger.getLogger("com.sysmuse.structure");
    private static boolean initialized = false;
    private static Level currentLevel = Level.INFO;

    // INFO and below to stdout, SEVERE additionally to stderr
    private static class ConsoleHandler extends StreamHandler {
        ConsoleHandler(java.io.OutputStream stream, Level level) {
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
     * Initialize logging from the analyzer configuration. Only the first call has an effect.
     */
    public static synchronized void initialize(AnalyzerConfig config) {
        initialize(config.getLoggingLevel(), config.isConsoleLoggingEnabled(),
                config.isFileLoggingEnabled(), config.getLogFileName());
    }

    public static synchronized void initialize(String levelStr, boolean consoleEnabled,
                                               boolean fileEnabled, String fileName) {
        if (initialized) {
            return;
        }

        currentLevel = parseLevel(levelStr);
        for (Handler handler : logger.getHandlers()) {
            logger.removeHandler(handler);
        }

        if (consoleEnabled) {
            logger.addHandler(new ConsoleHandler(System.out, currentLevel));
            logger.addHandler(new ConsoleHandler(System.err, Level.SEVERE));
        }

        String fileTarget = "disabled";
        if (fileEnabled && fileName != null && !fileName.isEmpty()) {
            try {
                FileHandler fileHandler = new FileHandler(fileName, true);
                fileHandler.setFormatter(new SimpleFormatter());
                fileHandler.setLevel(currentLevel);
                logger.addHandler(fileHandler);
                fileTarget = fileName;
            } catch (IOException e) {
                logger.log(Level.SEVERE, "Failed to create log file: " + fileName, e);
            }
        }

        logger.setLevel(currentLevel);
        logger.setUseParentHandlers(false);
        initialized = true;

        logger.fine("Logging initialized: level=" + currentLevel +
                ", console=" + consoleEnabled + ", file=" + fileTarget);
    }

    static Level parseLevel(String levelStr) {
        if (levelStr == null) return Level.INFO;
        switch (levelStr.toUpperCase()) {
            case "SEVERE": return Level.SEVERE;
            case "WARNING": return Level.WARNING;
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            default: return Level.INFO;
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

    public static void warn(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.WARNING, message, t);
    }

    public static void error(String message, Throwable t) {
        ensureInitialized();
        logger.log(Level.SEVERE, message, t);
    }

    public static boolean isDebugEnabled() {
        return currentLevel.intValue() <= Level.FINE.intValue();
    }

    private static void ensureInitialized() {
        if (!initialized) {
            initialize("INFO", true, false, null);
        }
    }
}
