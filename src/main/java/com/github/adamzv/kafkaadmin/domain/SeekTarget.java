package com.github.adamzv.kafkaadmin.domain;

/**
 * Position a consumer group partition should be moved to. {@code offset} is either a concrete
 * offset or one of the {@link #EARLIEST}/{@link #LATEST} sentinels, resolved by the consumer.
 */
public record SeekTarget(
    String topic,
    int partition,
    long offset
) {

  public static final long LATEST = -1L;
  public static final long EARLIEST = -2L;

  public boolean isSentinel() {
    return offset == LATEST || offset == EARLIEST;
  }
}
