package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record TopicOffsetsQuery(
    String topic,
    boolean fromBeginning,
    List<Integer> partitions
) {}
