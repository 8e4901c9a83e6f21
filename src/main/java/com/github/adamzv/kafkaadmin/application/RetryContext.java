package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.ProblemException;
import java.time.Duration;

/**
 * State of one retried operation, handed to every attempt. {@code lastError} is null on the
 * first attempt.
 */
public record RetryContext(
    int retryCount,
    Duration retryTime,
    ProblemException lastError
) {}
