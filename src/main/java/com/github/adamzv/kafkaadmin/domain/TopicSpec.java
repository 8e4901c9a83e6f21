package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record TopicSpec(
    String topic,
    Integer numPartitions,
    Short replicationFactor,
    List<ReplicaAssignment> replicaAssignment,
    List<ConfigEntry> configEntries
) {}
