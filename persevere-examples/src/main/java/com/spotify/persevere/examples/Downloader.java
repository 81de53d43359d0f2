package com.spotify.persevere.examples;

import com.spotify.persevere.Retry;
import com.spotify.persevere.RetriableOptions;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;

/** Reads everything a {@link DialUp} line has to offer, one retriable read at a time. */
public class Downloader {
  static final String TAG = "dial-up";

  private static final RetriableOptions READ_OPTIONS = RetriableOptions.tagged(TAG);

  private final DialUp line;

  public Downloader(DialUp line) {
    this.line = line;
  }

  /**
   * Downloads until the end of the line. Without an enclosing retry scope the first timeout is
   * thrown to the caller.
   */
  public List<Integer> download() throws SocketTimeoutException {
    final List<Integer> data = new ArrayList<>();
    while (true) {
      final int value = Retry.retriable(READ_OPTIONS, line::read);
      if (value == DialUp.EOF) {
        return data;
      }
      data.add(value);
    }
  }
}
