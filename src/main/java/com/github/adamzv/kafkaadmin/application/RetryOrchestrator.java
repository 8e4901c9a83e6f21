package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.RetryPolicy;
import java.time.Duration;
import org.apache.kafka.common.utils.ExponentialBackoff;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs an admin operation until it succeeds, hits a fatal or tolerated error, or runs out of
 * attempts. Once exhausted, the last error is rethrown as is.
 */
@Component
public class RetryOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(RetryOrchestrator.class);

  private final RetryPolicy policy;
  private final Time time;

  public RetryOrchestrator(RetryPolicy policy, Time time) {
    this.policy = policy;
    this.time = time;
  }

  public <T> T execute(RetryStrategy<T> strategy, Attempt<T> attempt) {
    ExponentialBackoff backoff = new ExponentialBackoff(
        policy.initialRetryTime().toMillis(),
        policy.multiplier(),
        policy.maxRetryTime().toMillis(),
        policy.factor()
    );
    long start = time.milliseconds();
    ProblemException lastError = null;

    for (int retryCount = 0; ; retryCount++) {
      RetryContext context = new RetryContext(
          retryCount,
          Duration.ofMillis(time.milliseconds() - start),
          lastError
      );
      try {
        return attempt.run(context);
      } catch (ProblemException ex) {
        long retryTime = time.milliseconds() - start;
        RetryStrategy.Verdict verdict = strategy.classify(ex);

        if (verdict == RetryStrategy.Verdict.TOLERATE) {
          return strategy.toleratedValue(ex);
        }
        if (verdict == RetryStrategy.Verdict.FATAL) {
          String guidance = strategy.guidanceFor(ex);
          if (guidance != null) {
            log.error("{} error={} retryCount={} retryTime={}", guidance, ex.getMessage(), retryCount, retryTime);
          }
          throw ex;
        }

        log.warn(
            "{} error={} retryCount={} retryTime={}",
            strategy.description(),
            ex.getMessage(),
            retryCount,
            retryTime
        );
        if (retryCount >= policy.retries() || retryTime >= policy.maxRetryTime().toMillis()) {
          throw ex;
        }

        strategy.beforeRetry(ex);
        lastError = ex;
        time.sleep(backoff.backoff(retryCount));
      }
    }
  }

  @FunctionalInterface
  public interface Attempt<T> {
    T run(RetryContext context);
  }
}
