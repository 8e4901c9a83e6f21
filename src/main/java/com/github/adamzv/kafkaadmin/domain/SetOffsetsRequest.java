package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record SetOffsetsRequest(
    String groupId,
    String topic,
    List<SeekEntry> partitions
) {}
