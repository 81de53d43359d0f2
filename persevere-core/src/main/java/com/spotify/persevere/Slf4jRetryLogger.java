package com.spotify.persevere;

import com.google.common.annotations.VisibleForTesting;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class Slf4jRetryLogger implements RetryLogger {
  static final Slf4jRetryLogger INSTANCE = new Slf4jRetryLogger();

  private static final Logger log = LoggerFactory.getLogger(Slf4jRetryLogger.class);

  private Slf4jRetryLogger() {}

  @Override
  public void onRetry(RuntimeException failure, int attempt, long delayMs) {
    if (log.isWarnEnabled()) {
      log.warn(format(failure, delayMs));
    }
  }

  @VisibleForTesting
  static String format(RuntimeException failure, long delayMs) {
    return String.format(
        Locale.ROOT, "%s, retrying in %.1f seconds...", describe(failure), delayMs / 1000.0);
  }

  private static String describe(RuntimeException failure) {
    if (failure instanceof RetriableFailure) {
      return String.valueOf(failure.getCause());
    }
    return failure.toString();
  }
}
