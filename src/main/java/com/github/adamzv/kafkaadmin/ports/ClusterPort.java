package com.github.adamzv.kafkaadmin.ports;

import com.github.adamzv.kafkaadmin.domain.ClusterMetadata;
import com.github.adamzv.kafkaadmin.domain.PartitionMetadata;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.TopicOffsets;
import com.github.adamzv.kafkaadmin.domain.TopicOffsetsQuery;
import java.util.List;
import java.util.Set;

/**
 * Routing view of the cluster: cached metadata, the tracked topic set, and lookup of the
 * broker that should receive a given request.
 */
public interface ClusterPort {

  void connect() throws ProblemException;

  void disconnect();

  /**
   * Fetches fresh metadata for the given topics; an empty list means every topic.
   */
  ClusterMetadata metadata(List<String> topics) throws ProblemException;

  /**
   * Brokers, controller and cluster id, without any topic metadata.
   */
  ClusterMetadata describeCluster() throws ProblemException;

  void refreshMetadata() throws ProblemException;

  void refreshMetadataIfNecessary() throws ProblemException;

  void addTargetTopic(String topic) throws ProblemException;

  void removeTargetTopic(String topic);

  Set<String> targetTopics();

  List<PartitionMetadata> findTopicPartitionMetadata(String topic);

  BrokerPort findControllerBroker() throws ProblemException;

  BrokerPort findGroupCoordinator(String groupId) throws ProblemException;

  BrokerPort findBroker(int nodeId) throws ProblemException;

  /**
   * Node ids of every broker in the pool, in pool order.
   */
  List<Integer> brokerNodeIds();

  long defaultOffset(boolean fromBeginning);

  List<TopicOffsets> fetchTopicsOffset(List<TopicOffsetsQuery> queries) throws ProblemException;
}
