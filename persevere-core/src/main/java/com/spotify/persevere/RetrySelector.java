package com.spotify.persevere;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;
import java.util.function.Predicate;
import javax.annotation.Nullable;

/** Decides whether a retry scope claims a wrapped failure. */
@FunctionalInterface
public interface RetrySelector {

  /**
   * Tests a failure against this selector.
   *
   * @param failure the wrapped failure, a {@link RetriableFailure} unless the operation supplied
   *     its own wrapper
   * @return {@code true} if the scope should handle the failure
   */
  boolean matches(RuntimeException failure);

  /** Selector that claims every failure. */
  static RetrySelector any() {
    return failure -> true;
  }

  /**
   * Selector that claims failures of retriable operations declared with an equal tag. Failures
   * wrapped by a custom wrapper never match.
   *
   * @param tag the tag to match
   * @return the selector
   */
  static RetrySelector tag(@Nullable Object tag) {
    return failure ->
        failure instanceof RetriableFailure
            && Objects.equals(((RetriableFailure) failure).getTag(), tag);
  }

  /**
   * Selector backed by an arbitrary predicate.
   *
   * @param predicate predicate over the wrapped failure
   * @return the selector
   */
  static RetrySelector matching(Predicate<? super RuntimeException> predicate) {
    checkNotNull(predicate, "predicate");
    return predicate::test;
  }
}
