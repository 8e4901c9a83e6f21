package com.github.adamzv.kafkaadmin.domain;

public record GroupDescription(
    String groupId,
    GroupState state
) {}
