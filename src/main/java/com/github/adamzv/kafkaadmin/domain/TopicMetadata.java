package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record TopicMetadata(
    String topic,
    List<PartitionMetadata> partitionMetadata
) {}
