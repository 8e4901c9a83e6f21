package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record PartitionMetadata(
    int partitionErrorCode,
    int partitionId,
    int leader,
    List<Integer> replicas,
    List<Integer> isr
) {}
