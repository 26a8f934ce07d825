package org.broadinstitute.methseg.utils;

import com.google.common.collect.ImmutableMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;

import java.util.Map;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;

/**
 * Logging utilities.
 *
 * The verbosity argument of every tool is an htsjdk {@link Log.LogLevel}, since log4j levels are not an enum the
 * argument parser can work with. Setting it propagates the level to htsjdk, log4j and java.util.logging.
 */
public final class LoggingUtils {

    private static final Map<Log.LogLevel, Level> LOG4J_LEVELS = ImmutableMap.of(
            Log.LogLevel.ERROR, Level.ERROR,
            Log.LogLevel.WARNING, Level.WARN,
            Log.LogLevel.INFO, Level.INFO,
            Log.LogLevel.DEBUG, Level.DEBUG);

    private static final Map<Log.LogLevel, java.util.logging.Level> JAVA_UTIL_LEVELS = ImmutableMap.of(
            Log.LogLevel.ERROR, java.util.logging.Level.SEVERE,
            Log.LogLevel.WARNING, java.util.logging.Level.WARNING,
            Log.LogLevel.INFO, java.util.logging.Level.INFO,
            Log.LogLevel.DEBUG, java.util.logging.Level.FINEST);

    private LoggingUtils() {}

    /**
     * Converts an htsjdk log level to a log4j log level.
     */
    public static Level levelToLog4jLevel(final Log.LogLevel htsjdkLevel) {
        return LOG4J_LEVELS.get(Utils.nonNull(htsjdkLevel, "the level cannot be null"));
    }

    /**
     * Propagate the verbosity level to htsjdk, log4j and the java built in logger.
     */
    public static void setLoggingLevel(final Log.LogLevel verbosity) {
        Utils.nonNull(verbosity, "the verbosity cannot be null");

        Log.setGlobalLogLevel(verbosity);
        setLog4JLoggingLevel(verbosity);
        setJavaUtilLoggingLevel(verbosity);
    }

    private static void setLog4JLoggingLevel(final Log.LogLevel verbosity) {
        final LoggerContext loggerContext = (LoggerContext) LogManager.getContext(false);
        loggerContext.getConfiguration().getRootLogger().setLevel(levelToLog4jLevel(verbosity));
        loggerContext.updateLoggers();
    }

    private static void setJavaUtilLoggingLevel(final Log.LogLevel verbosity) {
        final Logger topLogger = java.util.logging.Logger.getLogger("");

        Handler consoleHandler = null;
        for (final Handler handler : topLogger.getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                consoleHandler = handler;
                break;
            }
        }

        if (consoleHandler == null) {
            consoleHandler = new ConsoleHandler();
            topLogger.addHandler(consoleHandler);
        }
        consoleHandler.setLevel(JAVA_UTIL_LEVELS.get(verbosity));
    }
}
