package org.tessera.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.List;
import java.util.Map;

/**
 * Applies the HOCON {@code logging} block to Logback at runtime.
 *
 * <pre>
 * logging {
 *   format = "PLAIN"          # "PLAIN" or "JSON"
 *   default-level = "WARN"    # root logger level
 *   levels {
 *     "org.tessera.autotile" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    public static final String FORMAT_PROPERTY = "tessera.logging.format";
    /** Appender logback.xml selects when {@link #FORMAT_PROPERTY} is unset. */
    private static final String DEFAULT_APPENDER = "STDOUT_PLAIN";
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
        // Utility class
    }

    /**
     * Configures logging from the given configuration. Calling it again has no effect
     * until {@link #reset()} is called.
     *
     * @param config The application configuration.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            configureFormat(loggingConfig, context);
        } catch (final JoranException e) {
            LOGGER.error("Failed to switch log format, keeping the current appenders.", e);
        }
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        loggingConfigured = true;
        LOGGER.debug("Logging configuration applied.");
    }

    /**
     * Selects the console appender and reloads logback.xml so the choice takes effect.
     * Turbo filters installed before the reload are restored afterwards.
     */
    private static void configureFormat(final Config loggingConfig, final LoggerContext context) throws JoranException {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? "STDOUT" : "STDOUT_PLAIN";
        final String current = context.getProperty(FORMAT_PROPERTY) != null
            ? context.getProperty(FORMAT_PROPERTY)
            : System.getProperty(FORMAT_PROPERTY, DEFAULT_APPENDER);
        if (appender.equals(current)) {
            return;
        }

        System.setProperty(FORMAT_PROPERTY, appender);
        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl != null) {
            final List<TurboFilter> turboFilters = List.copyOf(context.getTurboFilterList());
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            try {
                configurator.doConfigure(configUrl);
            } finally {
                for (final TurboFilter filter : turboFilters) {
                    if (!context.getTurboFilterList().contains(filter)) {
                        filter.start();
                        context.addTurboFilter(filter);
                    }
                }
            }
        }
        context.putProperty(FORMAT_PROPERTY, appender);
        LOGGER.debug("Configured logging format: {}", format);
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            return;
        }
        final String levelName = loggingConfig.getString(DEFAULT_LEVEL_KEY);
        final Level level = Level.toLevel(levelName, null);
        if (level == null) {
            LOGGER.warn("Ignoring unknown default log level '{}'", levelName);
            return;
        }
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        LOGGER.debug("Configured default log level: {}", level);
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        // Logger names contain dots, so read the raw object rather than config paths.
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getObject(LEVELS_KEY).entrySet()) {
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'", levelName, entry.getKey());
                continue;
            }
            context.getLogger(entry.getKey()).setLevel(level);
            LOGGER.debug("Configured logger '{}' to level: {}", entry.getKey(), level);
        }
    }

    /**
     * Resets the configured flag so tests can apply another configuration.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
