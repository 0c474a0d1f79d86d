package org.declref.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies log levels from configuration to the Logback context:
 * {@code logging.level} sets the root level and {@code logging.levels} maps
 * logger names to levels.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    public static void configure(final Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                    .setLevel(Level.toLevel(config.getString("logging.level"), Level.INFO));
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                String loggerName = entry.getKey();
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(loggerName).setLevel(Level.toLevel(level, Level.INFO));
            }
        }
    }
}
