package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record TopicOffsets(
    String topic,
    List<PartitionOffset> partitions
) {}
