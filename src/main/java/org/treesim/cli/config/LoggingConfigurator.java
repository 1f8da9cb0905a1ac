package org.treesim.cli.config;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} configuration block to Logback.
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels { "org.treesim.runtime" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator() {
    }

    /**
     * @param config the application configuration.
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            LOG.warn("Logging backend is not Logback, log levels from configuration are ignored");
            return;
        }
        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.default-level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getConfig("logging.levels").entrySet()) {
                String loggerName = entry.getKey().replace("\"", "");
                context.getLogger(loggerName).setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO));
            }
        }
    }

    /**
     * Overrides the root level, e.g. for {@code --verbose}.
     *
     * @param level a Logback level name.
     */
    public static void setRootLevel(String level) {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(level, Level.INFO));
        }
    }
}
