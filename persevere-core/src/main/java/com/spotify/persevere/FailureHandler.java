package com.spotify.persevere;

import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what happens when a retriable operation fails with a catchable exception.
 *
 * <p>The failure is wrapped and offered to the active scopes, innermost first. The first scope
 * whose selector matches resolves the strategy bound to the failure site and asks it for a delay.
 * {@link #handle} then either returns normally after logging and sleeping, meaning the operation
 * should run again, or throws: the original exception when no scope claimed the failure, the
 * wrapper when the strategy gave up.
 */
final class FailureHandler {
  private static final Logger log = LoggerFactory.getLogger(FailureHandler.class);

  private FailureHandler() {}

  static <E extends Exception> void handle(
      Exception original, int attempt, FailureSite site, RetriableOptions options) throws E {
    final RuntimeException failure = options.wrap(original, site);
    final RetryScope scope = findScope(failure);
    if (scope == null) {
      log.debug("No retry scope claims failure of {}, rethrowing", site);
      throw FailureHandler.<E>uncheckedCast(original);
    }

    final OptionalLong delay = scope.strategyFor(site).delayMs(attempt);
    if (delay.isEmpty()) {
      log.info("Giving up on {} after {} attempts: {}", site, attempt, original.toString());
      throw failure;
    }

    final long delayMs = delay.getAsLong();
    scope.logger().onRetry(failure, attempt, delayMs);
    try {
      scope.sleeper().sleep(delayMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      final RuntimeException interrupted = new RuntimeException("Retry backoff interrupted", e);
      interrupted.addSuppressed(failure);
      throw interrupted;
    }
  }

  private static RetryScope findScope(RuntimeException failure) {
    for (RetryScope scope : RetryContext.current()) {
      if (scope.claims(failure)) {
        return scope;
      }
    }
    return null;
  }

  // only called with exceptions the operation itself threw, so they are E or unchecked
  @SuppressWarnings("unchecked")
  static <E extends Exception> E uncheckedCast(Exception exception) {
    return (E) exception;
  }
}
