package com.spotify.persevere;

import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sets the level of the library's SLF4J loggers.
 *
 * <p>Only Logback is supported. Logback is looked up reflectively, so it stays an optional
 * dependency; with any other SLF4J binding the call is a no-op and the binding's own configuration
 * applies.
 */
class LoggingConfigurator {
  static final String ROOT_LOGGER_NAME = "com.spotify.persevere";

  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private static Class<?> logbackLevelClass = null;
  private static Class<?> logbackLoggerClass = null;
  private static Method setLevelMethod = null;
  private static boolean logbackAvailable = false;

  static {
    initializeLogbackSupport();
  }

  private LoggingConfigurator() {}

  /**
   * Applies {@code level} to the library's root logger.
   *
   * @return {@code true} if the level was applied
   */
  static boolean configure(LoggingLevel level) {
    return configure(ROOT_LOGGER_NAME, level);
  }

  static boolean configure(String loggerName, LoggingLevel level) {
    if (loggerName == null || level == null || !logbackAvailable) {
      return false;
    }
    final Logger slf4jLogger = LoggerFactory.getLogger(loggerName);
    if (!logbackLoggerClass.isInstance(slf4jLogger)) {
      return false;
    }
    try {
      setLevelMethod.invoke(slf4jLogger, logbackLevelClass.getField(level.name()).get(null));
      return true;
    } catch (ReflectiveOperationException e) {
      log.warn("Could not set level {} on logger {}", level, loggerName, e);
      return false;
    }
  }

  static boolean isLogbackAvailable() {
    return logbackAvailable;
  }

  private static void initializeLogbackSupport() {
    try {
      logbackLevelClass = Class.forName("ch.qos.logback.classic.Level");
      logbackLoggerClass = Class.forName("ch.qos.logback.classic.Logger");
      setLevelMethod = logbackLoggerClass.getMethod("setLevel", logbackLevelClass);
      logbackAvailable = true;
    } catch (ClassNotFoundException | NoSuchMethodException e) {
      // no Logback on the classpath
      logbackAvailable = false;
    }
  }
}
