package com.github.adamzv.kafkaadmin.domain;

public record GroupListing(
    String groupId,
    String protocolType
) {}
