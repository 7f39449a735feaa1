package org.outbreak.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} block of the HOCON configuration to Logback.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "INFO"    # root logger level
 *   levels {
 *     "org.outbreak.runtime.SimulationEngine" = "DEBUG"
 *   }
 * }
 * </pre>
 *
 * Only the first call of {@link #configure} per process has an effect.
 */
public final class LoggingConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    /**
     * Name of the context and system property that selects the console appender in logback.xml.
     */
    public static final String FORMAT_PROPERTY = "outbreak.logging.format";

    private static boolean applied = false;

    private LoggingConfigurator() {}

    /**
     * Sets the console appender and the logger levels from the configuration. Unknown level names are
     * logged and skipped; a malformed block leaves Logback as it is.
     *
     * @param config The merged application configuration.
     */
    public static void configure(final Config config) {
        if (applied) {
            LOG.debug("Logging already configured, skipping");
            return;
        }
        applied = true;
        if (!config.hasPath("logging")) {
            return;
        }

        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            final Config logging = config.getConfig("logging");

            final String appender = appenderFor(logging.hasPath("format") ? logging.getString("format") : "PLAIN");
            context.putProperty(FORMAT_PROPERTY, appender);
            System.setProperty(FORMAT_PROPERTY, appender);

            if (logging.hasPath("default-level")) {
                setLevel(context, Logger.ROOT_LOGGER_NAME, logging.getString("default-level"));
            }
            if (logging.hasPath("levels")) {
                logging.getObject("levels").forEach((name, value) ->
                        setLevel(context, name, String.valueOf(value.unwrapped())));
            }
        } catch (final ConfigException e) {
            LOG.error("Malformed logging configuration, keeping Logback defaults: {}", e.getMessage());
        }
    }

    /**
     * Maps a configured log format to the name of the console appender declared in logback.xml.
     * @param format "JSON" or "PLAIN", case-insensitive; anything else counts as PLAIN.
     * @return The appender name.
     */
    public static String appenderFor(final String format) {
        return "JSON".equalsIgnoreCase(format) ? "STDOUT_JSON" : "STDOUT";
    }

    private static void setLevel(final LoggerContext context, final String loggerName, final String levelName) {
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            LOG.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
            return;
        }
        context.getLogger(loggerName).setLevel(level);
        LOG.debug("Logger '{}' set to {}", loggerName, level);
    }

    /**
     * Allows {@link #configure} to run again. Used by tests.
     */
    public static void reset() {
        applied = false;
    }
}
