package com.github.adamzv.kafkaadmin.domain;

import java.time.Duration;

/**
 * Bounds for one retried admin operation. An operation gets {@code retries + 1} attempts,
 * and never retries once {@code maxRetryTime} has elapsed.
 */
public record RetryPolicy(
    int retries,
    Duration initialRetryTime,
    int multiplier,
    double factor,
    Duration maxRetryTime
) {

  public static RetryPolicy defaults() {
    return new RetryPolicy(5, Duration.ofMillis(300), 2, 0.2, Duration.ofSeconds(30));
  }
}
