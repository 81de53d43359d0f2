package com.spotify.persevere;

/** Blocks the calling thread for the backoff delay. */
@FunctionalInterface
public interface Sleeper {

  void sleep(long delayMs) throws InterruptedException;

  /** The sleeper backed by {@link Thread#sleep(long)}. */
  static Sleeper system() {
    return Thread::sleep;
  }
}
