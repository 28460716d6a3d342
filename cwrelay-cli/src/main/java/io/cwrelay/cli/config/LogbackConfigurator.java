package io.cwrelay.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Programmatic Logback configuration from the HOCON {@code logging} block.
 * Logs go to standard error so dry-run output on standard output stays clean.
 *
 * <pre>
 * logging {
 *     level = "INFO"
 *     pattern = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level %logger{36} - %msg%n"
 *     loggers {
 *         "io.cwrelay" = "INFO"
 *         "software.amazon.awssdk" = "WARN"
 *     }
 * }
 * </pre>
 */
public class LogbackConfigurator {

    private static final String DEFAULT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";
    private static final String DEFAULT_LEVEL = "INFO";

    private LogbackConfigurator() {
    }

    /**
     * @param verbose forces the root and {@code io.cwrelay} loggers to DEBUG
     */
    public static void configure(Config config, boolean verbose) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.reset();

        String pattern = getStringOrDefault(config, "logging.pattern", DEFAULT_PATTERN);
        String rootLevel = getStringOrDefault(config, "logging.level", DEFAULT_LEVEL);

        ConsoleAppender<ILoggingEvent> consoleAppender = new ConsoleAppender<>();
        consoleAppender.setContext(context);
        consoleAppender.setName("CONSOLE");
        consoleAppender.setTarget("System.err");

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(pattern);
        encoder.start();

        consoleAppender.setEncoder(encoder);
        consoleAppender.start();

        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.toLevel(rootLevel, Level.INFO));
        rootLogger.addAppender(consoleAppender);

        if (config.hasPath("logging.loggers")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.loggers").entrySet()) {
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(level, Level.INFO));
            }
        }

        setLoggerLevel(context, "software.amazon.awssdk", "WARN");

        if (verbose) {
            rootLogger.setLevel(Level.DEBUG);
            context.getLogger("io.cwrelay").setLevel(Level.DEBUG);
        }
    }

    private static void setLoggerLevel(LoggerContext context, String name, String level) {
        Logger logger = context.getLogger(name);
        if (logger.getLevel() == null) {
            logger.setLevel(Level.toLevel(level));
        }
    }

    private static String getStringOrDefault(Config config, String path, String defaultValue) {
        if (config.hasPath(path)) {
            return config.getString(path);
        }
        return defaultValue;
    }
}
