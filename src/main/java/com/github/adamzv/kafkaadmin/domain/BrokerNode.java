package com.github.adamzv.kafkaadmin.domain;

public record BrokerNode(
    int nodeId,
    String host,
    int port
) {}
