package com.spotify.persevere;

/**
 * Console logging levels for the library's own loggers.
 *
 * @see Retry#configureLogging(LoggingLevel)
 */
public enum LoggingLevel {
  /** All logging levels enabled, including TRACE and DEBUG messages */
  ALL,
  /** TRACE level and above (TRACE, DEBUG, INFO, WARN, ERROR) */
  TRACE,
  /** DEBUG level and above (DEBUG, INFO, WARN, ERROR) */
  DEBUG,
  /** INFO level and above (INFO, WARN, ERROR) */
  INFO,
  /** WARN level and above (WARN, ERROR), which includes the default retry log lines */
  WARN,
  /** ERROR level only */
  ERROR,
  /** No logging output */
  OFF
}
