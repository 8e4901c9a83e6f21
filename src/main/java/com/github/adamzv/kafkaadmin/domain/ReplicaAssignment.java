package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ReplicaAssignment(
    int partition,
    List<Integer> replicas
) {}
