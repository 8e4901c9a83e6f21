package com.github.adamzv.kafkaadmin.support;

import com.github.adamzv.kafkaadmin.domain.RetryPolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "admin.retry")
public record RetryProperties(
    @PositiveOrZero(message = "admin.retry.retries must be >= 0")
    int retries,
    @NotNull(message = "admin.retry.initialRetryTime is required")
    Duration initialRetryTime,
    @Positive(message = "admin.retry.multiplier must be > 0")
    int multiplier,
    @DecimalMin(value = "0.0", message = "admin.retry.factor must be >= 0")
    @DecimalMax(value = "1.0", message = "admin.retry.factor must be <= 1")
    double factor,
    @NotNull(message = "admin.retry.maxRetryTime is required")
    Duration maxRetryTime
) {

  public RetryPolicy toDomain() {
    return new RetryPolicy(retries, initialRetryTime, multiplier, factor, maxRetryTime);
  }

  @AssertTrue(message = "admin.retry.initialRetryTime must be <= admin.retry.maxRetryTime")
  public boolean isInitialWithinMax() {
    return initialRetryTime == null || maxRetryTime == null || initialRetryTime.compareTo(maxRetryTime) <= 0;
  }
}
