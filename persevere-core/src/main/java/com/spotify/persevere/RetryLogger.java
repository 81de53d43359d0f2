package com.spotify.persevere;

/** Hook invoked every time a retry scope decides to retry a failed operation. */
@FunctionalInterface
public interface RetryLogger {

  /**
   * Called before the scope sleeps and lets the operation retry.
   *
   * @param failure the wrapped failure
   * @param attempt the number of the attempt that failed, starting at 1
   * @param delayMs how long the scope is about to wait
   */
  void onRetry(RuntimeException failure, int attempt, long delayMs);

  /**
   * The logger used by scopes that don't configure one. It writes a WARN line through SLF4J with
   * the underlying error and the delay in seconds.
   */
  static RetryLogger defaultLogger() {
    return Slf4jRetryLogger.INSTANCE;
  }

  /** A logger that does nothing. */
  static RetryLogger silent() {
    return (failure, attempt, delayMs) -> {};
  }
}
