package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record PartitionsSpec(
    String topic,
    int count,
    List<List<Integer>> assignments
) {}
