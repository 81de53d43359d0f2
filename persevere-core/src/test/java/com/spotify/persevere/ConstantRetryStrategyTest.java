package com.spotify.persevere;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.OptionalLong;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ConstantRetryStrategyTest {

  private static List<OptionalLong> delays(RetryStrategy strategy, int attempts) {
    return IntStream.rangeClosed(1, attempts)
        .mapToObj(strategy::delayMs)
        .collect(Collectors.toList());
  }

  @Test
  void testSameDelayForEveryAttempt() {
    assertThat(delays(RetryStrategy.constant(100), 10)).containsOnly(OptionalLong.of(100));
  }

  @Test
  void testKeepsReturningDelayForLargeAttemptNumbers() {
    assertThat(RetryStrategy.constant(7).delayMs(Integer.MAX_VALUE)).hasValue(7);
  }

  @Test
  void testStopsAfterMaxCount() {
    final List<OptionalLong> delays = delays(RetryStrategy.constant(10, 5), 10);

    assertThat(delays.subList(0, 5)).containsOnly(OptionalLong.of(10));
    assertThat(delays.subList(5, 10)).containsOnly(OptionalLong.empty());
  }

  @Test
  void testMaxCountNotReached() {
    assertThat(delays(RetryStrategy.constant(1000, 5), 3)).containsOnly(OptionalLong.of(1000));
  }

  @Test
  void testZeroMaxCountNeverRetries() {
    assertThat(RetryStrategy.constant(10, 0).delayMs(1)).isEmpty();
  }

  @Test
  void testSameAnswerForSameAttempt() {
    final RetryStrategy strategy = RetryStrategy.constant(25, 2);
    assertThat(strategy.delayMs(2)).isEqualTo(strategy.delayMs(2));
    assertThat(strategy.delayMs(3)).isEqualTo(strategy.delayMs(3));
  }

  @Test
  void testRejectsInvalidArguments() {
    assertThatThrownBy(() -> new ConstantRetryStrategy(-1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new ConstantRetryStrategy(10, -1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> RetryStrategy.constant(10).delayMs(0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void testEqualsAndHashCode() {
    assertThat(new ConstantRetryStrategy(10, 3)).isEqualTo(new ConstantRetryStrategy(10, 3));
    assertThat(new ConstantRetryStrategy(10, 3).hashCode())
        .isEqualTo(new ConstantRetryStrategy(10, 3).hashCode());
    assertThat(new ConstantRetryStrategy(10)).isNotEqualTo(new ConstantRetryStrategy(10, 3));
    assertThat(new ConstantRetryStrategy(10).toString()).contains("delayMs=10");
  }
}
