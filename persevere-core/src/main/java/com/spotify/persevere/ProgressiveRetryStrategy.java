package com.spotify.persevere;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * A retry strategy with a rising delay.
 *
 * <p>The first {@code stableLength} attempts wait {@code initialDelayMs}. Every attempt after that
 * multiplies the delay by {@code multiplier}, so attempt {@code n} waits {@code initialDelayMs *
 * multiplier^(n - stableLength)}. The delay never exceeds {@code maxDelayMs}. When a {@code
 * maxCount} is configured the strategy stops once more than that many attempts have failed.
 *
 * <p>With an initial delay of 1ms, a stable length of 3 and a multiplier of 2, attempts 1 to 10
 * wait 1, 1, 1, 2, 4, 8, 16, 32, 64 and 128 milliseconds.
 */
public final class ProgressiveRetryStrategy implements RetryStrategy {

  static final long DEFAULT_INITIAL_DELAY_MS = 500;
  static final int DEFAULT_STABLE_LENGTH = 3;
  static final double DEFAULT_MULTIPLIER = 2.0;
  static final long DEFAULT_MAX_DELAY_MS = 60_000;

  private final long initialDelayMs;
  private final int stableLength;
  private final double multiplier;
  private final long maxDelayMs;
  private final OptionalInt maxCount;

  private ProgressiveRetryStrategy(Builder builder) {
    checkArgument(
        builder.initialDelayMs >= 0,
        "initialDelayMs must not be negative: %s",
        builder.initialDelayMs);
    checkArgument(
        builder.stableLength >= 0, "stableLength must not be negative: %s", builder.stableLength);
    checkArgument(
        builder.multiplier >= 1.0, "multiplier must be at least 1: %s", builder.multiplier);
    checkArgument(
        builder.maxDelayMs >= builder.initialDelayMs,
        "maxDelayMs (%s) must not be smaller than initialDelayMs (%s)",
        builder.maxDelayMs,
        builder.initialDelayMs);
    checkArgument(
        builder.maxCount.orElse(0) >= 0,
        "maxCount must not be negative: %s",
        builder.maxCount.orElse(0));
    this.initialDelayMs = builder.initialDelayMs;
    this.stableLength = builder.stableLength;
    this.multiplier = builder.multiplier;
    this.maxDelayMs = builder.maxDelayMs;
    this.maxCount = builder.maxCount;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public OptionalLong delayMs(int attempt) {
    checkArgument(attempt >= 1, "attempt must be at least 1: %s", attempt);
    if (maxCount.isPresent() && attempt > maxCount.getAsInt()) {
      return OptionalLong.empty();
    }
    if (attempt <= stableLength) {
      return OptionalLong.of(initialDelayMs);
    }
    // computed in floating point so large attempt numbers saturate at maxDelayMs
    final double delay = initialDelayMs * Math.pow(multiplier, attempt - stableLength);
    return OptionalLong.of((long) Math.min(delay, maxDelayMs));
  }

  public long getInitialDelayMs() {
    return initialDelayMs;
  }

  public int getStableLength() {
    return stableLength;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public long getMaxDelayMs() {
    return maxDelayMs;
  }

  public OptionalInt getMaxCount() {
    return maxCount;
  }

  @Override
  public String toString() {
    return "ProgressiveRetryStrategy{"
        + "initialDelayMs="
        + initialDelayMs
        + ", stableLength="
        + stableLength
        + ", multiplier="
        + multiplier
        + ", maxDelayMs="
        + maxDelayMs
        + ", maxCount="
        + maxCount
        + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final ProgressiveRetryStrategy that = (ProgressiveRetryStrategy) o;
    return initialDelayMs == that.initialDelayMs
        && stableLength == that.stableLength
        && Double.compare(that.multiplier, multiplier) == 0
        && maxDelayMs == that.maxDelayMs
        && maxCount.equals(that.maxCount);
  }

  @Override
  public int hashCode() {
    return Objects.hash(initialDelayMs, stableLength, multiplier, maxDelayMs, maxCount);
  }

  public static class Builder {
    private long initialDelayMs = DEFAULT_INITIAL_DELAY_MS;
    private int stableLength = DEFAULT_STABLE_LENGTH;
    private double multiplier = DEFAULT_MULTIPLIER;
    private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
    private OptionalInt maxCount = OptionalInt.empty();

    private Builder() {}

    /** Delay used for the first {@code stableLength} attempts. Defaults to 500ms. */
    public Builder initialDelayMs(long initialDelayMs) {
      this.initialDelayMs = initialDelayMs;
      return this;
    }

    /** Number of attempts that keep the initial delay. Defaults to 3. */
    public Builder stableLength(int stableLength) {
      this.stableLength = stableLength;
      return this;
    }

    /** Growth factor applied per attempt after the stable phase. Defaults to 2. */
    public Builder multiplier(double multiplier) {
      this.multiplier = multiplier;
      return this;
    }

    /** Upper bound of any computed delay. Defaults to one minute. */
    public Builder maxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
      return this;
    }

    /** Number of retries after which the strategy stops. Unlimited by default. */
    public Builder maxCount(int maxCount) {
      this.maxCount = OptionalInt.of(maxCount);
      return this;
    }

    public ProgressiveRetryStrategy build() {
      return new ProgressiveRetryStrategy(this);
    }
  }
}
