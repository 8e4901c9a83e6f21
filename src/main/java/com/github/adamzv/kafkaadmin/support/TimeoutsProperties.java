package com.github.adamzv.kafkaadmin.support;

import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "admin.timeouts")
public record TimeoutsProperties(
    @NotNull(message = "admin.timeouts.requestTimeout is required")
    Duration requestTimeout,
    @NotNull(message = "admin.timeouts.leaderWaitDelay is required")
    Duration leaderWaitDelay,
    @NotNull(message = "admin.timeouts.leaderWaitMax is required")
    Duration leaderWaitMax,
    @NotNull(message = "admin.timeouts.offsetCommit is required")
    Duration offsetCommit,
    @NotNull(message = "admin.timeouts.metadataMaxAge is required")
    Duration metadataMaxAge
) {

  public AdminTimeouts toDomain() {
    return new AdminTimeouts(requestTimeout, leaderWaitDelay, leaderWaitMax, offsetCommit, metadataMaxAge);
  }

  @AssertTrue(message = "admin.timeouts.leaderWaitDelay must be <= admin.timeouts.leaderWaitMax")
  public boolean isLeaderWaitDelayWithinMax() {
    return leaderWaitDelay == null || leaderWaitMax == null || leaderWaitDelay.compareTo(leaderWaitMax) <= 0;
  }
}
