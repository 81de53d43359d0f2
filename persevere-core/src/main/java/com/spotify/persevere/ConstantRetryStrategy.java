package com.spotify.persevere;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;

/** A retry strategy that returns the same delay for every attempt, optionally up to a limit. */
public final class ConstantRetryStrategy implements RetryStrategy {

  private final long delayMs;
  private final OptionalInt maxCount;

  /**
   * Creates a strategy without an attempt limit.
   *
   * @param delayMs delay in milliseconds, must not be negative
   */
  public ConstantRetryStrategy(long delayMs) {
    this(delayMs, OptionalInt.empty());
  }

  /**
   * Creates a strategy that stops once more than {@code maxCount} attempts have failed.
   *
   * @param delayMs delay in milliseconds, must not be negative
   * @param maxCount maximum number of retries, must not be negative
   */
  public ConstantRetryStrategy(long delayMs, int maxCount) {
    this(delayMs, OptionalInt.of(maxCount));
  }

  private ConstantRetryStrategy(long delayMs, OptionalInt maxCount) {
    checkArgument(delayMs >= 0, "delayMs must not be negative: %s", delayMs);
    checkArgument(
        maxCount.orElse(0) >= 0, "maxCount must not be negative: %s", maxCount.orElse(0));
    this.delayMs = delayMs;
    this.maxCount = maxCount;
  }

  @Override
  public OptionalLong delayMs(int attempt) {
    checkArgument(attempt >= 1, "attempt must be at least 1: %s", attempt);
    if (maxCount.isPresent() && attempt > maxCount.getAsInt()) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(delayMs);
  }

  public long getDelayMs() {
    return delayMs;
  }

  public OptionalInt getMaxCount() {
    return maxCount;
  }

  @Override
  public String toString() {
    return "ConstantRetryStrategy{" + "delayMs=" + delayMs + ", maxCount=" + maxCount + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final ConstantRetryStrategy that = (ConstantRetryStrategy) o;
    return delayMs == that.delayMs && maxCount.equals(that.maxCount);
  }

  @Override
  public int hashCode() {
    return Objects.hash(delayMs, maxCount);
  }
}
