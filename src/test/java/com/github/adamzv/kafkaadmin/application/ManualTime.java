package com.github.adamzv.kafkaadmin.application;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.apache.kafka.common.utils.Time;

/**
 * Clock that only moves when someone sleeps on it or advances it.
 */
class ManualTime implements Time {

  private final AtomicLong nowMs = new AtomicLong(1_000L);
  private final AtomicLong sleptMs = new AtomicLong();

  @Override
  public long milliseconds() {
    return nowMs.get();
  }

  @Override
  public long nanoseconds() {
    return nowMs.get() * 1_000_000L;
  }

  @Override
  public void sleep(long ms) {
    sleptMs.addAndGet(ms);
    nowMs.addAndGet(ms);
  }

  @Override
  public void waitObject(Object obj, Supplier<Boolean> condition, long deadlineMs) {
    while (!condition.get()) {
      if (milliseconds() >= deadlineMs) {
        throw new org.apache.kafka.common.errors.TimeoutException("Condition not satisfied before deadline");
      }
      sleep(1L);
    }
  }

  void advance(long ms) {
    nowMs.addAndGet(ms);
  }

  long sleptMs() {
    return sleptMs.get();
  }
}
