package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record CreatePartitionsRequest(
    List<PartitionsSpec> topicPartitions,
    Boolean validateOnly,
    Integer timeout
) {}
