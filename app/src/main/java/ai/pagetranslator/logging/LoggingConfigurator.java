package ai.pagetranslator.logging;

import ai.pagetranslator.config.LogFormat;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Switches the console output between the text pattern and JSON lines at startup.
 * The per-run log file always stays plain text so the diagnostic boxes remain readable.
 */
public final class LoggingConfigurator {

    static final String APPLICATION_LOGGER = "ai.pagetranslator";
    static final String TEXT_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} %-5level [%thread] [page=%X{page:-}] %logger{36} - %msg%n";

    private LoggingConfigurator() {
    }

    public static void configure(LogFormat format) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context) {
            configure(context, format);
        }
    }

    static void configure(LoggerContext context, LogFormat format) {
        for (OutputStreamAppender<ILoggingEvent> appender : consoleAppenders(context)) {
            switch (format) {
                case JSON -> applyJsonEncoder(context, appender);
                case TEXT -> applyTextEncoder(context, appender);
            }
        }
    }

    private static List<OutputStreamAppender<ILoggingEvent>> consoleAppenders(LoggerContext context) {
        List<OutputStreamAppender<ILoggingEvent>> appenders = new ArrayList<>();
        for (String name : List.of(Logger.ROOT_LOGGER_NAME, APPLICATION_LOGGER)) {
            for (var iterator = context.getLogger(name).iteratorForAppenders(); iterator.hasNext(); ) {
                Appender<ILoggingEvent> appender = iterator.next();
                if (appender instanceof OutputStreamAppender<ILoggingEvent> stream && !(appender instanceof FileAppender)
                        && !appenders.contains(stream)) {
                    appenders.add(stream);
                }
            }
        }
        return appenders;
    }

    private static void applyJsonEncoder(LoggerContext context, OutputStreamAppender<ILoggingEvent> appender) {
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(context);
        encoder.setLayout(layout);
        encoder.start();
        restartAppender(appender, encoder);
    }

    private static void applyTextEncoder(LoggerContext context, OutputStreamAppender<ILoggingEvent> appender) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        restartAppender(appender, encoder);
    }

    private static void restartAppender(OutputStreamAppender<ILoggingEvent> appender, Encoder<ILoggingEvent> encoder) {
        boolean running = appender.isStarted();
        if (running) {
            appender.stop();
        }
        appender.setEncoder(encoder);
        if (running) {
            appender.start();
        }
    }
}
