package com.spotify.persevere;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.MapMaker;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One active {@link Retry#retry} call.
 *
 * <p>The first time a failure site is claimed by this scope the scope's strategy is bound to that
 * site, and later failures of the same site keep using it even if the set of active scopes has
 * changed in between. Sites are weakly referenced so finished retriable operations don't pile up
 * in long-lived scopes.
 */
final class RetryScope {
  private static final Logger log = LoggerFactory.getLogger(RetryScope.class);

  private final RetryStrategy strategy;
  private final RetrySelector selector;
  private final RetryLogger logger;
  private final Sleeper sleeper;
  private final ConcurrentMap<FailureSite, RetryStrategy> strategies =
      new MapMaker().weakKeys().makeMap();

  RetryScope(RetryScopeOptions options) {
    this.strategy = options.getStrategy();
    this.selector = options.getSelector();
    this.logger = options.getLogger();
    this.sleeper = options.getSleeper();
  }

  boolean claims(RuntimeException failure) {
    return selector.matches(failure);
  }

  RetryStrategy strategyFor(FailureSite site) {
    return strategies.computeIfAbsent(
        site,
        s -> {
          log.debug("Binding {} to {}", s, strategy);
          return strategy;
        });
  }

  RetryLogger logger() {
    return logger;
  }

  Sleeper sleeper() {
    return sleeper;
  }

  @VisibleForTesting
  int trackedSites() {
    return strategies.size();
  }

  @Override
  public String toString() {
    return "RetryScope{" + "strategy=" + strategy + ", trackedSites=" + strategies.size() + '}';
  }
}
