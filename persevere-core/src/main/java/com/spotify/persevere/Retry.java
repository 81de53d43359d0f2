package com.spotify.persevere;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.Beta;
import com.google.common.collect.ImmutableList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry points for marking operations as retriable and for establishing retry scopes.
 *
 * <p>The two halves are independent. Code that talks to an unreliable resource wraps the call in
 * {@link #retriable}; code further up the call chain decides whether and how to retry by wrapping
 * its work in {@link #retry}:
 *
 * <pre>{@code
 * List<Row> rows =
 *     Retry.retry(
 *         RetryScopeOptions.withStrategy(RetryStrategy.constant(1_000, 5)),
 *         () -> Retry.retriable(() -> client.fetchRows()));
 * }</pre>
 *
 * <p>A retriable operation with no enclosing scope that wants its failure behaves exactly like the
 * bare operation. Scopes are tracked per thread.
 */
public final class Retry {
  private static final Logger log = LoggerFactory.getLogger(Retry.class);

  private Retry() {}

  /**
   * Runs {@code operation} as a retriable operation that catches {@link java.io.IOException}.
   *
   * @see #retriable(RetriableOptions, CheckedSupplier)
   */
  public static <T, E extends Exception> T retriable(@Nonnull CheckedSupplier<T, E> operation)
      throws E {
    return retriable(RetriableOptions.defaults(), operation);
  }

  /**
   * Runs {@code operation}, letting the enclosing retry scopes retry it when it fails with one of
   * the catchable exception types.
   *
   * <p>On a catchable failure the innermost scope that claims it decides: either it waits and the
   * operation runs again, or it gives up and a {@link RetriableFailure} (or the custom wrapper) is
   * thrown. A failure no scope claims is rethrown as is, and non-catchable exceptions are never
   * intercepted.
   *
   * @param options which exceptions to catch, the tag and the optional wrapper
   * @param operation the operation to run
   * @return the result of the first successful attempt
   * @throws E if the operation fails and no scope claims the failure
   */
  public static <T, E extends Exception> T retriable(
      @Nonnull RetriableOptions options, @Nonnull CheckedSupplier<T, E> operation) throws E {
    checkNotNull(options, "options");
    checkNotNull(operation, "operation");
    final FailureSite site = new FailureSite();
    int attempt = 1;
    while (true) {
      try {
        return operation.get();
      } catch (Exception e) {
        if (!options.isCatchable(e)) {
          throw FailureHandler.<E>uncheckedCast(e);
        }
        FailureHandler.<E>handle(e, attempt, site, options);
        attempt++;
      }
    }
  }

  /**
   * Runs {@code body} inside a retry scope with default options.
   *
   * @see #retry(RetryScopeOptions, CheckedSupplier)
   */
  public static <T, E extends Exception> T retry(@Nonnull CheckedSupplier<T, E> body) throws E {
    return retry(RetryScopeOptions.defaults(), body);
  }

  /**
   * Runs {@code body} inside a new retry scope. Failures of retriable operations executed by
   * {@code body} on this thread are offered to the scope while it is active. The scope is removed
   * when {@code body} returns or throws.
   *
   * @param options strategy, selector, logger and sleeper of the scope
   * @param body the code to run inside the scope
   * @return the result of {@code body}
   * @throws E if {@code body} throws
   */
  public static <T, E extends Exception> T retry(
      @Nonnull RetryScopeOptions options, @Nonnull CheckedSupplier<T, E> body) throws E {
    checkNotNull(options, "options");
    checkNotNull(body, "body");
    final RetryScope scope = new RetryScope(options);
    try (RetryContext.Frame ignored = RetryContext.enter(scope)) {
      log.debug("Entered {} at depth {}", scope, RetryContext.current().size());
      return body.get();
    } finally {
      log.debug("Left {}", scope);
    }
  }

  /**
   * Makes the retry scopes active on the calling thread also active while {@code task} runs,
   * wherever it runs.
   */
  @Beta
  public static Runnable wrap(@Nonnull Runnable task) {
    checkNotNull(task, "task");
    final ImmutableList<RetryScope> captured = RetryContext.current();
    return () -> {
      try (RetryContext.Frame ignored = RetryContext.install(captured)) {
        task.run();
      }
    };
  }

  /** Callable variant of {@link #wrap(Runnable)}. */
  @Beta
  public static <V> Callable<V> wrap(@Nonnull Callable<V> task) {
    checkNotNull(task, "task");
    final ImmutableList<RetryScope> captured = RetryContext.current();
    return () -> {
      try (RetryContext.Frame ignored = RetryContext.install(captured)) {
        return task.call();
      }
    };
  }

  /**
   * Returns an executor that runs each task with the retry scopes that were active on the thread
   * submitting it.
   */
  @Beta
  public static Executor wrap(@Nonnull Executor executor) {
    checkNotNull(executor, "executor");
    return command -> executor.execute(wrap(command));
  }

  /** Number of retry scopes active on the calling thread. */
  public static int activeScopeCount() {
    return RetryContext.current().size();
  }

  /**
   * Sets the level of the library's loggers, including the default retry logger. Works when
   * Logback is the SLF4J binding and does nothing otherwise.
   *
   * @param level the level to apply
   * @return {@code true} if the level was applied
   */
  public static boolean configureLogging(@Nonnull LoggingLevel level) {
    return LoggingConfigurator.configure(level);
  }
}
