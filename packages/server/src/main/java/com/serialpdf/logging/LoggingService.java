package com.serialpdf.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;
import java.io.File;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and applying logging settings from {@code
 * application.yaml}.
 *
 * <p>Supported keys:
 *
 * <ul>
 *   <li>{@code logging.level.<logger-name>}: level for a logger ({@code root} for the root logger)
 *   <li>{@code logging.directory}: if set, a size-rotated {@code serial-pdf.log} is written there
 *   <li>{@code logging.file-max-size}: rotation threshold, e.g. {@code 250MB}
 *   <li>{@code logging.file-max-history}: number of rotated files kept besides the live one
 * </ul>
 */
public final class LoggingService {
  static final String FILE_APPENDER_NAME = "SERIALPDF_FILE";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply logger levels and the optional file appender. Safe to call more than once. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }

    Configuration levels = configuration.subset("logging.level");
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (StringUtils.isBlank(value)) continue;
      // Hierarchical configurations escape dots inside a YAML key by doubling them
      String loggerName =
          "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name.replace("..", ".");
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.INFO));
    }

    String directory = configuration.getString("logging.directory", null);
    if (StringUtils.isNotBlank(directory)) {
      attachFileAppender(
          context,
          new File(directory.trim()),
          configuration.getString("logging.file-max-size", "250MB"),
          configuration.getInt("logging.file-max-history", 3));
    }
  }

  private static void attachFileAppender(
      LoggerContext context, File logsDir, String maxSize, int maxHistory) {
    ch.qos.logback.classic.Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    if (root.getAppender(FILE_APPENDER_NAME) != null) {
      return;
    }
    if (!logsDir.exists()) {
      // noinspection ResultOfMethodCallIgnored
      logsDir.mkdirs();
    }
    File logFile = new File(logsDir, "serial-pdf.log");

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName(FILE_APPENDER_NAME);
    fileAppender.setFile(logFile.getPath());

    FixedWindowRollingPolicy rollingPolicy = new FixedWindowRollingPolicy();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(new File(logsDir, "serial-pdf.%i.log").getPath());
    rollingPolicy.setMinIndex(1);
    rollingPolicy.setMaxIndex(Math.max(1, maxHistory));
    rollingPolicy.start();

    SizeBasedTriggeringPolicy<ILoggingEvent> triggeringPolicy = new SizeBasedTriggeringPolicy<>();
    triggeringPolicy.setContext(context);
    triggeringPolicy.setMaxFileSize(FileSize.valueOf(maxSize));
    triggeringPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern(
        "%d{dd.MM.yyyy HH:mm:ss Z} [%-5level] (@%thread) [%X{jobId}] %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.setTriggeringPolicy(triggeringPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    getLogger(LoggingService.class).info("File logging enabled at {}", logFile.getPath());
  }
}
