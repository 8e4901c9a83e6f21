package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ClusterDescription(
    List<BrokerNode> brokers,
    Integer controller,
    String clusterId
) {}
