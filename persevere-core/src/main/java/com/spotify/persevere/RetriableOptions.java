package com.spotify.persevere;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Options of a retriable operation.
 *
 * <p>They control which exceptions are handed to the enclosing retry scopes ({@link
 * Builder#catching}, {@link IOException} by default), the tag scopes can select on, and optionally
 * a custom wrapper replacing {@link RetriableFailure}. Exceptions outside the catchable set
 * propagate right away.
 */
public final class RetriableOptions {
  private static final RetriableOptions DEFAULTS = builder().build();

  private final ImmutableSet<Class<? extends Exception>> catching;
  @Nullable private final Object tag;
  @Nullable private final Function<? super Exception, ? extends RuntimeException> wrapper;

  private RetriableOptions(Builder builder) {
    this.catching =
        builder.catching != null ? builder.catching : ImmutableSet.of(IOException.class);
    this.tag = builder.tag;
    this.wrapper = builder.wrapper;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Options catching {@link IOException}, without a tag or custom wrapper. */
  public static RetriableOptions defaults() {
    return DEFAULTS;
  }

  /** Shortcut for default options with the given tag. */
  public static RetriableOptions tagged(@Nonnull Object tag) {
    return builder().tag(tag).build();
  }

  @Nonnull
  public ImmutableSet<Class<? extends Exception>> getCatching() {
    return catching;
  }

  @Nonnull
  public Optional<Object> getTag() {
    return Optional.ofNullable(tag);
  }

  @Nonnull
  public Optional<Function<? super Exception, ? extends RuntimeException>> getWrapper() {
    return Optional.ofNullable(wrapper);
  }

  boolean isCatchable(Exception exception) {
    for (Class<? extends Exception> type : catching) {
      if (type.isInstance(exception)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Wraps a caught exception. A custom wrapper takes precedence over the tag.
   *
   * @throws NullPointerException if the custom wrapper returns {@code null}
   */
  RuntimeException wrap(Exception exception, FailureSite site) {
    if (wrapper != null) {
      return checkNotNull(wrapper.apply(exception), "wrapper returned null for %s", exception);
    }
    return new RetriableFailure(tag, exception, site);
  }

  @Override
  public String toString() {
    return "RetriableOptions{"
        + "catching="
        + catching
        + ", tag="
        + tag
        + ", wrapper="
        + (wrapper != null ? "custom" : "none")
        + '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    final RetriableOptions that = (RetriableOptions) o;
    return catching.equals(that.catching)
        && Objects.equals(tag, that.tag)
        && Objects.equals(wrapper, that.wrapper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(catching, tag, wrapper);
  }

  public static class Builder {
    private ImmutableSet<Class<? extends Exception>> catching;
    private Object tag;
    private Function<? super Exception, ? extends RuntimeException> wrapper;

    private Builder() {}

    /**
     * Sets the exception types handed to retry scopes, replacing the default {@link IOException}.
     * Subclasses of the given types are caught too.
     */
    @SafeVarargs
    public final Builder catching(Class<? extends Exception>... types) {
      checkArgument(types.length > 0, "at least one exception type is required");
      return catching(Arrays.asList(types));
    }

    public Builder catching(Iterable<? extends Class<? extends Exception>> types) {
      final ImmutableSet<Class<? extends Exception>> set = ImmutableSet.copyOf(types);
      checkArgument(!set.isEmpty(), "at least one exception type is required");
      this.catching = set;
      return this;
    }

    /** Attaches a tag to failures of this operation, for {@link RetrySelector#tag} to match. */
    public Builder tag(@Nullable Object tag) {
      this.tag = tag;
      return this;
    }

    /**
     * Replaces {@link RetriableFailure} with a custom wrapper. The tag is ignored when a wrapper is
     * set.
     */
    public Builder wrapper(
        @Nonnull Function<? super Exception, ? extends RuntimeException> wrapper) {
      this.wrapper = checkNotNull(wrapper, "wrapper");
      return this;
    }

    public RetriableOptions build() {
      return new RetriableOptions(this);
    }
  }
}
