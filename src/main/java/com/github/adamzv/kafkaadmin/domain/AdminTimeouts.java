package com.github.adamzv.kafkaadmin.domain;

import java.time.Duration;

public record AdminTimeouts(
    Duration request,
    Duration leaderWaitDelay,
    Duration leaderWaitMax,
    Duration offsetCommit,
    Duration metadataMaxAge
) {

  public static AdminTimeouts defaults() {
    return new AdminTimeouts(
        Duration.ofSeconds(5),
        Duration.ofMillis(100),
        Duration.ofSeconds(10),
        Duration.ofSeconds(30),
        Duration.ofMinutes(5)
    );
  }
}
