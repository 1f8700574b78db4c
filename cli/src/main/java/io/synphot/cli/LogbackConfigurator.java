package io.synphot.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.synphot.cli.config.CliConfig;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of a {@link CliConfig} to Logback.
 *
 * <p>
 * Command output owns standard out, so the single appender writes to standard error. The root
 * level and any per-logger levels (for example {@code io.synphot.core.engine: DEBUG} to trace
 * cache loads) come from the configuration.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level [%logger{0}] %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    public static void configure(CliConfig config) {
        configure(config.loggingFormat(), config.loggingLevel(), config.loggerLevels());
    }

    /**
     * @param format       "json" for one JSON object per event, anything else for text
     * @param level        root level; INFO when unrecognized
     * @param loggerLevels logger name → level; unrecognized levels are skipped with a warning
     */
    public static void configure(String format, String level, Map<String, String> loggerLevels) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.setLevel(Level.toLevel(level, Level.INFO));
        root.addAppender(stderrAppender(context, encoder(context, format)));

        List<String> rejected = new ArrayList<>();
        for (Map.Entry<String, String> entry : loggerLevels.entrySet()) {
            Level loggerLevel = Level.toLevel(entry.getValue(), null);
            if (loggerLevel == null) {
                rejected.add(entry.getKey() + "=" + entry.getValue());
            } else {
                context.getLogger(entry.getKey()).setLevel(loggerLevel);
            }
        }
        if (!rejected.isEmpty()) {
            context.getLogger(LogbackConfigurator.class).warn("Ignoring unknown logger levels {}", rejected);
        }
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(
            LoggerContext context, Encoder<ILoggingEvent> encoder) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }
}
