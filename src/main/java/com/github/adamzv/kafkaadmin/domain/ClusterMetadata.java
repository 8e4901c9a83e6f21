package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ClusterMetadata(
    List<BrokerNode> brokers,
    int controllerId,
    String clusterId,
    List<TopicMetadata> topicMetadata
) {

  public static final int NO_CONTROLLER_ID = -1;

  public boolean hasController() {
    return controllerId != NO_CONTROLLER_ID;
  }
}
