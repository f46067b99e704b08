package io.stageflow.standalone.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Programmatic Logback setup for the runner: text or JSON console output and the root level.
 *
 * <p>
 * JSON mode uses Logback's {@link JsonEncoder}, which carries the {@code pipeline},
 * {@code transformer} and {@code stage} MDC keys as structured fields. Text mode prints them in
 * brackets. Logs go to stderr so that the run summary on stdout stays clean.
 */
public final class LogbackConfigurator {

    /** Human-readable pattern for text mode. */
    static final String TEXT_PATTERN =
            "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} [%X{pipeline}/%X{transformer}/%X{stage}] - %msg%n";

    static final String APPENDER_NAME = "CONSOLE";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root logger's appenders with a single console appender.
     *
     * @param format "json" for structured output, anything else for the text pattern
     * @param level  root level (TRACE, DEBUG, INFO, WARN, ERROR); unknown values mean INFO
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);

        rootLogger.setLevel(Level.toLevel(level, Level.INFO));
        rootLogger.detachAndStopAllAppenders();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(context, format));
        appender.start();
        rootLogger.addAppender(appender);
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder encoder = new JsonEncoder();
            encoder.setContext(context);
            encoder.start();
            return encoder;
        }
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
