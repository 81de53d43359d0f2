package com.spotify.persevere;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of one activation of a retriable operation.
 *
 * <p>A new site is created every time {@link Retry#retriable} starts, before the first attempt, and
 * stays the same for all attempts of that activation. Scopes key their per-site strategy state by
 * this identity, so two activations never share an attempt sequence even when they run the same
 * code. Sites are compared by identity; the id only shows up in diagnostics.
 */
public final class FailureSite {
  private static final AtomicLong ids = new AtomicLong();

  private final long id;

  FailureSite() {
    this.id = ids.incrementAndGet();
  }

  @Override
  public String toString() {
    return "FailureSite#" + id;
  }
}
