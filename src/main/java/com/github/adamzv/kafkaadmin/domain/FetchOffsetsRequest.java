package com.github.adamzv.kafkaadmin.domain;

public record FetchOffsetsRequest(
    String groupId,
    String topic
) {}
