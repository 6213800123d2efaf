package com.gentoro.doctrans.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central access point for loggers. Levels may be tuned from {@code application.yaml} through
 * {@code logging.level.<logger-name>} keys, e.g. {@code logging.level.com.gentoro.doctrans: DEBUG}.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** Apply {@code logging.level.*} overrides to the running Logback context. */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }
    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> keys = levels.getKeys(); keys.hasNext(); ) {
      String loggerName = keys.next();
      String value = levels.getString(loggerName);
      if (value == null || value.isBlank()) continue;
      String name = "root".equalsIgnoreCase(loggerName) ? Logger.ROOT_LOGGER_NAME : loggerName;
      context.getLogger(name).setLevel(Level.toLevel(value.trim(), Level.INFO));
    }
  }
}
