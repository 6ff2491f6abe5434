package com.gentoro.docextract.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers.
 *
 * <p>Besides handing out SLF4J loggers, it applies per-logger levels declared in the application
 * configuration under {@code logging.level}, e.g.
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.docextract.pipeline: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply configured log levels. Unknown level names fall back to DEBUG, as Logback does. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) {
      return;
    }
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      return;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    Iterator<String> keys = levels.getKeys();
    while (keys.hasNext()) {
      String name = keys.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) {
        continue;
      }
      // hierarchical configurations escape dots inside YAML keys as ".."
      String unescaped = name.replace("..", ".");
      String loggerName =
          "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.DEBUG));
    }
  }
}
