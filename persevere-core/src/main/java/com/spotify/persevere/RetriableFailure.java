package com.spotify.persevere;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Uniform envelope around an exception thrown by a retriable operation.
 *
 * <p>Scopes see this wrapper when they select failures and log retries. It is thrown to the caller
 * when the strategy of the scope that claimed the failure gives up, so an exhausted retry can
 * always be told apart from a failure no scope wanted (which is rethrown unwrapped). The original
 * exception is available as {@link #getCause()}.
 */
public class RetriableFailure extends RuntimeException {
  static final String MESSAGE = "Retriable code failed.";

  @Nullable private final Object tag;
  private final FailureSite site;

  public RetriableFailure(
      @Nullable Object tag, @Nonnull Exception cause, @Nonnull FailureSite site) {
    super(MESSAGE, cause);
    this.tag = tag;
    this.site = site;
  }

  /**
   * Gets the tag the retriable operation was declared with.
   *
   * @return the tag, or {@code null} if the operation had none
   */
  @Nullable
  public Object getTag() {
    return tag;
  }

  /**
   * Gets the site of the retriable operation that failed.
   *
   * @return the failure site
   */
  @Nonnull
  public FailureSite getSite() {
    return site;
  }

  @Override
  public synchronized Exception getCause() {
    return (Exception) super.getCause();
  }
}
