package com.spotify.persevere.examples;

import com.spotify.persevere.Retry;
import com.spotify.persevere.RetryScopeOptions;
import com.spotify.persevere.RetryStrategy;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DialUpDemo {
  private static final Logger log = LoggerFactory.getLogger(DialUpDemo.class);

  public static void main(String[] args) throws Exception {
    final int size = args.length > 0 ? Integer.parseInt(args[0]) : 20;
    final Downloader downloader = new Downloader(new DialUp(size, new Random()));

    final List<Integer> data =
        Retry.retry(
            RetryScopeOptions.builder()
                .strategy(RetryStrategy.constant(200))
                .selectTag(Downloader.TAG)
                .build(),
            downloader::download);

    log.info("Downloaded {} values: {}", data.size(), data);
  }
}
