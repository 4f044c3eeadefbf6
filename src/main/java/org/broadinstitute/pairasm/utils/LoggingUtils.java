package org.broadinstitute.pairasm.utils;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableMap;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;

import java.util.Map;

/**
 * Applies the {@code --verbosity} of a tool to every logging framework that writes to the console.
 *
 * The argument is typed as the htsjdk {@link Log.LogLevel} enum, which the parser can handle. From there it is mapped to
 * log4j for pairasm's own loggers, and to java.util.logging for the libraries that use it.
 */
public final class LoggingUtils {

    private LoggingUtils() {}

    private static final ImmutableBiMap<Log.LogLevel, Level> LOG4J_LEVELS = ImmutableBiMap.of(
            Log.LogLevel.ERROR, Level.ERROR,
            Log.LogLevel.WARNING, Level.WARN,
            Log.LogLevel.INFO, Level.INFO,
            Log.LogLevel.DEBUG, Level.DEBUG);

    private static final Map<Log.LogLevel, java.util.logging.Level> JUL_LEVELS = ImmutableMap.of(
            Log.LogLevel.ERROR, java.util.logging.Level.SEVERE,
            Log.LogLevel.WARNING, java.util.logging.Level.WARNING,
            Log.LogLevel.INFO, java.util.logging.Level.INFO,
            Log.LogLevel.DEBUG, java.util.logging.Level.FINEST);

    public static Level levelToLog4jLevel( final Log.LogLevel verbosity ) {
        return LOG4J_LEVELS.get(Utils.nonNull(verbosity, "verbosity"));
    }

    /**
     * @return the verbosity that maps to {@code log4jLevel}, or {@code null} for a log4j level with no htsjdk counterpart
     */
    static Log.LogLevel levelFromLog4jLevel( final Level log4jLevel ) {
        return LOG4J_LEVELS.inverse().get(log4jLevel);
    }

    public static void setLoggingLevel( final Log.LogLevel verbosity ) {
        Utils.nonNull(verbosity, "verbosity");
        Log.setGlobalLogLevel(verbosity);
        Configurator.setRootLevel(levelToLog4jLevel(verbosity));
        java.util.logging.Logger.getLogger("").setLevel(JUL_LEVELS.get(verbosity));
    }
}
