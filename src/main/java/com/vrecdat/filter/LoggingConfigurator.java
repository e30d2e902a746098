package com.vrecdat.filter;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.FileAppender;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Applies the command line logging options to the logback setup from {@code logback.xml}.
 * <p>
 * The root logger stays at DEBUG; the console appender gets a threshold filter for the chosen level and the
 * optional log file receives everything from DEBUG up.
 *
 * @author VREC DAT Filter Team
 * @since 1.0
 */
public final class LoggingConfigurator {
    private static final Logger logger = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String CONSOLE_APPENDER = "CONSOLE";
    static final String FILE_APPENDER = "FILE";
    static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} - %-5level - %msg%n";

    private LoggingConfigurator() {}

    /**
     * Sets the console threshold.
     * @param levelName Logback level name, e.g. {@code INFO} or {@code WARN}
     */
    public static void applyConsoleLevel(String levelName) {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.DEBUG);
        Appender<ILoggingEvent> console = root.getAppender(CONSOLE_APPENDER);
        if (console == null) {
            logger.debug("No '{}' appender configured; console level {} not applied.", CONSOLE_APPENDER, levelName);
            return;
        }
        ThresholdFilter filter = new ThresholdFilter();
        filter.setLevel(Level.toLevel(levelName, Level.INFO).toString());
        filter.setContext(ctx);
        filter.start();
        console.clearAllFilters();
        console.addFilter(filter);
    }

    /**
     * Installs a DEBUG file appender, replacing a previous one. The file is truncated.
     * @param file Log file; parent directories are created
     * @return true if the file appender is active
     */
    public static boolean addFileLog(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.isDirectory(parent)) {
                Files.createDirectories(parent);
                logger.info("Created directory for log file: {}", parent);
            }
        } catch (IOException e) {
            logger.error("Could not create directory for log file {}: {}", file, e.getMessage());
            return false;
        }

        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.DEBUG);
        removeFileLog();

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern(FILE_PATTERN);
        encoder.setCharset(StandardCharsets.UTF_8);
        encoder.start();

        FileAppender<ILoggingEvent> appender = new FileAppender<>();
        appender.setContext(ctx);
        appender.setName(FILE_APPENDER);
        appender.setFile(file.toAbsolutePath().toString());
        appender.setAppend(false);
        appender.setEncoder(encoder);
        appender.start();
        if (!appender.isStarted()) {
            logger.error("Could not open log file {} for writing.", file);
            return false;
        }
        root.addAppender(appender);
        logger.info("Logging detailed output (DEBUG level and above) to: {}", file);
        return true;
    }

    /**
     * Detaches and closes the file appender, if any.
     */
    public static void removeFileLog() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        Appender<ILoggingEvent> existing = root.getAppender(FILE_APPENDER);
        if (existing != null) {
            root.detachAppender(existing);
            existing.stop();
        }
    }
}
