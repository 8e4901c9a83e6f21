package com.github.adamzv.kafkaadmin.domain;

public record ResetOffsetsRequest(
    String groupId,
    String topic,
    Boolean earliest
) {}
