package com.github.adamzv.kafkaadmin.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import com.github.adamzv.kafkaadmin.domain.RetryPolicy;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class AdminPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropertiesConfig.class)
      .withPropertyValues(
          "admin.retry.retries=3",
          "admin.retry.initialRetryTime=200ms",
          "admin.retry.multiplier=2",
          "admin.retry.factor=0.1",
          "admin.retry.maxRetryTime=10s",
          "admin.timeouts.requestTimeout=5s",
          "admin.timeouts.leaderWaitDelay=100ms",
          "admin.timeouts.leaderWaitMax=10s",
          "admin.timeouts.offsetCommit=30s",
          "admin.timeouts.metadataMaxAge=5m"
      );

  @Test
  void bindsRetryPolicyAndTimeouts() {
    runner.run(context -> {
      RetryPolicy policy = context.getBean(RetryProperties.class).toDomain();
      AdminTimeouts timeouts = context.getBean(TimeoutsProperties.class).toDomain();

      assertEquals(new RetryPolicy(3, Duration.ofMillis(200), 2, 0.1, Duration.ofSeconds(10)), policy);
      assertEquals(Duration.ofSeconds(10), timeouts.leaderWaitMax());
      assertEquals(Duration.ofMinutes(5), timeouts.metadataMaxAge());
    });
  }

  @Test
  void rejectsInitialRetryTimeAboveMax() {
    runner.withPropertyValues("admin.retry.initialRetryTime=1m").run(context -> {
      assertNotNull(context.getStartupFailure());
      assertTrue(causeChainMentions(context.getStartupFailure(),
          "admin.retry.initialRetryTime must be <= admin.retry.maxRetryTime"));
    });
  }

  @Test
  void rejectsMissingTimeout() {
    runner.withPropertyValues("admin.timeouts.offsetCommit=").run(context -> {
      assertNotNull(context.getStartupFailure());
      assertTrue(causeChainMentions(context.getStartupFailure(), "admin.timeouts.offsetCommit is required"));
    });
  }

  private static boolean causeChainMentions(Throwable failure, String text) {
    for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
      if (cause.getMessage() != null && cause.getMessage().contains(text)) {
        return true;
      }
    }
    return false;
  }

  @EnableConfigurationProperties({RetryProperties.class, TimeoutsProperties.class})
  static class PropertiesConfig {
  }
}
