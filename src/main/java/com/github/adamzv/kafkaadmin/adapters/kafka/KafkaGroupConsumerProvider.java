package com.github.adamzv.kafkaadmin.adapters.kafka;

import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import com.github.adamzv.kafkaadmin.ports.GroupConsumerPort;
import com.github.adamzv.kafkaadmin.ports.GroupConsumerProvider;
import com.github.adamzv.kafkaadmin.support.KafkaProperties;
import org.springframework.stereotype.Component;

@Component
public class KafkaGroupConsumerProvider implements GroupConsumerProvider {

  private final KafkaProperties kafkaProperties;
  private final KafkaClusterAdapter cluster;
  private final AdminTimeouts timeouts;

  public KafkaGroupConsumerProvider(KafkaProperties kafkaProperties,
                                    KafkaClusterAdapter cluster,
                                    AdminTimeouts timeouts) {
    this.kafkaProperties = kafkaProperties;
    this.cluster = cluster;
    this.timeouts = timeouts;
  }

  @Override
  public GroupConsumerPort open(String groupId) {
    return new KafkaGroupConsumer(groupId, kafkaProperties, cluster, timeouts);
  }
}
