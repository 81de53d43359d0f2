package com.spotify.persevere;

import java.util.OptionalLong;

/**
 * Decides how long to wait before the next attempt of a failed operation.
 *
 * <p>Strategies are pure functions of the attempt number: the same instance asked about the same
 * attempt always gives the same answer. A strategy that wants to stop after a number of attempts
 * encodes that limit in its configuration rather than in mutable state.
 */
@FunctionalInterface
public interface RetryStrategy {

  /**
   * Computes the delay before retrying the given attempt.
   *
   * @param attempt the number of the attempt that just failed, starting at 1
   * @return the delay in milliseconds, or empty if no more retries should happen
   */
  OptionalLong delayMs(int attempt);

  /**
   * Creates a strategy that waits {@code delayMs} after every failed attempt, forever.
   *
   * @param delayMs delay in milliseconds
   * @return the strategy
   */
  static RetryStrategy constant(long delayMs) {
    return new ConstantRetryStrategy(delayMs);
  }

  /**
   * Creates a strategy that waits {@code delayMs} after each of the first {@code maxCount} failed
   * attempts and stops after that.
   *
   * @param delayMs delay in milliseconds
   * @param maxCount number of retries allowed
   * @return the strategy
   */
  static RetryStrategy constant(long delayMs, int maxCount) {
    return new ConstantRetryStrategy(delayMs, maxCount);
  }

  /**
   * Creates a progressive strategy with default settings (500ms initial delay kept for three
   * attempts, then doubling up to one minute, no attempt limit).
   *
   * @return the strategy
   * @see ProgressiveRetryStrategy#builder()
   */
  static RetryStrategy progressive() {
    return ProgressiveRetryStrategy.builder().build();
  }
}
