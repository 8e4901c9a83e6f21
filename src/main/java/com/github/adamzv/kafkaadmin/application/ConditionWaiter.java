package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.Problems;
import java.time.Duration;
import java.util.Map;
import java.util.function.BooleanSupplier;
import org.apache.kafka.common.utils.Time;
import org.springframework.stereotype.Component;

/**
 * Polls a condition at a fixed delay. Bounded by its own deadline, independent of any
 * surrounding retry loop.
 */
@Component
public class ConditionWaiter {

  private final Time time;

  public ConditionWaiter(Time time) {
    this.time = time;
  }

  public void waitFor(BooleanSupplier condition, Duration delay, Duration maxWait, String timeoutMessage) {
    long start = time.milliseconds();
    int checks = 0;
    while (true) {
      checks++;
      if (condition.getAsBoolean()) {
        return;
      }
      long waited = time.milliseconds() - start;
      if (waited >= maxWait.toMillis()) {
        throw Problems.waitTimeout(
            timeoutMessage,
            Map.of("maxWaitMs", maxWait.toMillis(), "checks", checks)
        );
      }
      time.sleep(Math.min(delay.toMillis(), maxWait.toMillis() - waited));
    }
  }
}
