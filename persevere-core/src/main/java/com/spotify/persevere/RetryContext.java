package com.spotify.persevere;

import com.google.common.collect.ImmutableList;

/**
 * The stack of retry scopes active on the current thread, innermost first.
 *
 * <p>Each thread sees only the scopes entered on it, or the ones explicitly handed to it through
 * {@link Retry#wrap(Runnable)}. The stack itself is an immutable list that is replaced on every
 * push, which makes capturing it for another thread a plain read.
 */
final class RetryContext {
  private static final ThreadLocal<ImmutableList<RetryScope>> scopes =
      ThreadLocal.withInitial(ImmutableList::of);

  private RetryContext() {}

  static ImmutableList<RetryScope> current() {
    return scopes.get();
  }

  /** Pushes {@code scope} on top of the current thread's stack until the frame is closed. */
  static Frame enter(RetryScope scope) {
    final ImmutableList<RetryScope> previous = scopes.get();
    scopes.set(ImmutableList.<RetryScope>builder().add(scope).addAll(previous).build());
    return new Frame(previous);
  }

  /** Replaces the current thread's stack with {@code captured} until the frame is closed. */
  static Frame install(ImmutableList<RetryScope> captured) {
    final ImmutableList<RetryScope> previous = scopes.get();
    scopes.set(captured);
    return new Frame(previous);
  }

  private static void restore(ImmutableList<RetryScope> previous) {
    if (previous.isEmpty()) {
      scopes.remove();
    } else {
      scopes.set(previous);
    }
  }

  /** Restores the stack that was active before the frame was opened. */
  static final class Frame implements AutoCloseable {
    private final ImmutableList<RetryScope> previous;

    private Frame(ImmutableList<RetryScope> previous) {
      this.previous = previous;
    }

    @Override
    public void close() {
      restore(previous);
    }
  }
}
