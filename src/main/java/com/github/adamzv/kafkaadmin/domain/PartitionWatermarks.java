package com.github.adamzv.kafkaadmin.domain;

public record PartitionWatermarks(
    int partition,
    long offset,
    long high,
    long low
) {}
