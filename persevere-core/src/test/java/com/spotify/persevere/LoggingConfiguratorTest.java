package com.spotify.persevere;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @AfterEach
  void restoreLevel() {
    Retry.configureLogging(LoggingLevel.DEBUG);
  }

  @Test
  void testLogbackIsDetected() {
    assertThat(LoggingConfigurator.isLogbackAvailable()).isTrue();
  }

  @Test
  void testConfigureSetsLevelOnLibraryLoggers() {
    assertThat(Retry.configureLogging(LoggingLevel.WARN)).isTrue();

    final Logger logger = LoggerFactory.getLogger(FailureHandler.class);
    assertThat(logger.isWarnEnabled()).isTrue();
    assertThat(logger.isInfoEnabled()).isFalse();
  }

  @Test
  void testOffSilencesDefaultRetryLogger() {
    Retry.configureLogging(LoggingLevel.OFF);

    assertThat(LoggerFactory.getLogger(Slf4jRetryLogger.class).isWarnEnabled()).isFalse();
  }

  @Test
  void testEveryLevelIsSupported() {
    for (LoggingLevel level : LoggingLevel.values()) {
      assertThat(LoggingConfigurator.configure("test.logger", level)).isTrue();
    }
  }

  @Test
  void testNullArgumentsAreIgnored() {
    assertThat(LoggingConfigurator.configure(null, LoggingLevel.INFO)).isFalse();
    assertThat(LoggingConfigurator.configure("test.logger", null)).isFalse();
  }
}
