package com.spotify.persevere.examples;

import java.net.SocketTimeoutException;
import java.util.Random;

/**
 * A simulated unreliable line serving the numbers 1 to {@code size}.
 *
 * <p>The line alternates between good and bad periods. A read during a good period returns the next
 * number, a read during a bad period times out. Every period lasts between one and five reads.
 * Reads after the last number return {@link #EOF}.
 */
public class DialUp {
  public static final int EOF = -1;

  private final Random random;
  private final int size;
  private boolean good = true;
  private int left = 3;
  private int next = 1;

  public DialUp(int size, Random random) {
    this.size = size;
    this.random = random;
  }

  public synchronized int read() throws SocketTimeoutException {
    if (left == 0) {
      good = !good;
      left = 1 + random.nextInt(5);
    } else {
      left--;
    }
    if (next > size) {
      return EOF;
    }
    if (!good) {
      throw new SocketTimeoutException("pshhhh-ft-ft");
    }
    return next++;
  }
}
