package org.ckbtextify.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Applies the {@code logging} block of the application configuration to Logback, so that a
 * deployment can turn on DEBUG output for single modules without editing {@code logback.xml}.
 *
 * <pre>
 * logging {
 *   default-level = "WARN"
 *   levels {
 *     "org.ckbtextify.modules.math" = "DEBUG"
 *   }
 * }
 * </pre>
 *
 * Unknown level names fall back to WARN for the root logger and INFO for named loggers.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String PATH = "logging";

    private static boolean applied = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies the configured levels once per JVM; later calls are ignored until {@link #reset()}.
     *
     * @param config The resolved application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (applied) {
            LOG.debug("Log levels already applied");
            return;
        }
        applied = true;
        if (!config.hasPath(PATH)) {
            return;
        }
        final Map<String, Level> levels;
        try {
            levels = levelsFrom(config.getConfig(PATH));
        } catch (final ConfigException e) {
            LOG.error("Ignoring malformed logging configuration: {}", e.getMessage());
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        levels.forEach((name, level) -> context.getLogger(name).setLevel(level));
        LOG.debug("Applied {} log level(s): {}", levels.size(), levels);
    }

    /**
     * Collects the logger levels, root first, in the order they are declared.
     */
    static Map<String, Level> levelsFrom(final Config logging) {
        final Map<String, Level> levels = new LinkedHashMap<>();
        if (logging.hasPath("default-level")) {
            levels.put(Logger.ROOT_LOGGER_NAME, Level.toLevel(logging.getString("default-level"), Level.WARN));
        }
        if (logging.hasPath("levels")) {
            logging.getObject("levels").forEach((name, value) ->
                    levels.put(name, Level.toLevel(String.valueOf(value.unwrapped()), Level.INFO)));
        }
        return levels;
    }

    /**
     * Allows the levels to be applied again. Used by tests.
     */
    public static synchronized void reset() {
        applied = false;
    }
}
