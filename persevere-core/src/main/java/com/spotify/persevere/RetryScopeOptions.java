package com.spotify.persevere;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import java.util.function.Predicate;
import javax.annotation.Nonnull;

/**
 * Options of a retry scope.
 *
 * <p>Unless configured otherwise a scope uses {@link RetryStrategy#progressive()}, claims every
 * failure, logs through {@link RetryLogger#defaultLogger()} and sleeps with {@link
 * Sleeper#system()}.
 */
public final class RetryScopeOptions {
  private static final RetryScopeOptions DEFAULTS = builder().build();

  private final RetryStrategy strategy;
  private final RetrySelector selector;
  private final RetryLogger logger;
  private final Sleeper sleeper;

  private RetryScopeOptions(Builder builder) {
    this.strategy = builder.strategy != null ? builder.strategy : RetryStrategy.progressive();
    this.selector = builder.selector != null ? builder.selector : RetrySelector.any();
    this.logger = builder.logger != null ? builder.logger : RetryLogger.defaultLogger();
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.system();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static RetryScopeOptions defaults() {
    return DEFAULTS;
  }

  /** Shortcut for default options with the given strategy. */
  public static RetryScopeOptions withStrategy(@Nonnull RetryStrategy strategy) {
    return builder().strategy(strategy).build();
  }

  @Nonnull
  public RetryStrategy getStrategy() {
    return strategy;
  }

  @Nonnull
  public RetrySelector getSelector() {
    return selector;
  }

  @Nonnull
  public RetryLogger getLogger() {
    return logger;
  }

  @Nonnull
  public Sleeper getSleeper() {
    return sleeper;
  }

  @Override
  public String toString() {
    return "RetryScopeOptions{"
        + "strategy="
        + strategy
        + ", selector="
        + selector
        + ", logger="
        + logger
        + ", sleeper="
        + sleeper
        + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final RetryScopeOptions that = (RetryScopeOptions) o;
    return strategy.equals(that.strategy)
        && selector.equals(that.selector)
        && logger.equals(that.logger)
        && sleeper.equals(that.sleeper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(strategy, selector, logger, sleeper);
  }

  public static class Builder {
    private RetryStrategy strategy;
    private RetrySelector selector;
    private RetryLogger logger;
    private Sleeper sleeper;

    private Builder() {}

    public Builder strategy(@Nonnull RetryStrategy strategy) {
      this.strategy = checkNotNull(strategy, "strategy");
      return this;
    }

    public Builder selector(@Nonnull RetrySelector selector) {
      this.selector = checkNotNull(selector, "selector");
      return this;
    }

    /** Claims only failures whose tag equals {@code tag}. */
    public Builder selectTag(@Nonnull Object tag) {
      return selector(RetrySelector.tag(checkNotNull(tag, "tag")));
    }

    /** Claims only failures accepted by {@code predicate}. */
    public Builder selectWhen(@Nonnull Predicate<? super RuntimeException> predicate) {
      return selector(RetrySelector.matching(predicate));
    }

    public Builder logger(@Nonnull RetryLogger logger) {
      this.logger = checkNotNull(logger, "logger");
      return this;
    }

    public Builder sleeper(@Nonnull Sleeper sleeper) {
      this.sleeper = checkNotNull(sleeper, "sleeper");
      return this;
    }

    public RetryScopeOptions build() {
      return new RetryScopeOptions(this);
    }
  }
}
