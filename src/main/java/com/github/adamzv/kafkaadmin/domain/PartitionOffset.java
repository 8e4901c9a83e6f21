package com.github.adamzv.kafkaadmin.domain;

public record PartitionOffset(
    int partition,
    long offset,
    String metadata
) {}
