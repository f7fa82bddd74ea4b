package org.cognita.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from the configuration to Logback at runtime.
 *
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels {
 *     "org.cognita.document.log" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private LoggingConfigurator() {
    }

    /**
     * Configures logger levels. Invalid entries are logged and skipped.
     *
     * @param config The root configuration containing an optional {@code logging} block.
     * @return The number of loggers whose level was set.
     */
    public static int configure(final Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return 0;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOGGER.debug("SLF4J is not bound to Logback, skipping logging configuration.");
            return 0;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        int configuredCount = 0;
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured default log level: {}", level);
        }
        if (loggingConfig.hasPath(LEVELS_KEY)) {
            for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
                final String loggerName = entry.getKey();
                final String levelName = String.valueOf(entry.getValue().unwrapped());
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
                    continue;
                }
                context.getLogger(loggerName).setLevel(level);
                configuredCount++;
                LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
            }
        }
        return configuredCount;
    }
}
