package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.AclRule;
import com.github.adamzv.kafkaadmin.domain.AclRuleFilter;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceRef;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceUpdate;
import com.github.adamzv.kafkaadmin.domain.DeleteAclsResponse;
import com.github.adamzv.kafkaadmin.domain.DescribeAclsResponse;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.GroupDeletionResult;
import com.github.adamzv.kafkaadmin.domain.ListGroupsResult;
import com.github.adamzv.kafkaadmin.domain.PartitionsSpec;
import com.github.adamzv.kafkaadmin.domain.TopicMetadata;
import com.github.adamzv.kafkaadmin.domain.TopicOffsets;
import com.github.adamzv.kafkaadmin.domain.TopicSpec;
import com.github.adamzv.kafkaadmin.ports.BrokerPort;
import java.util.List;

/**
 * Broker that rejects every request. Tests override the calls they expect.
 */
class StubBroker implements BrokerPort {

  private final int nodeId;

  StubBroker(int nodeId) {
    this.nodeId = nodeId;
  }

  @Override
  public int nodeId() {
    return nodeId;
  }

  @Override
  public void createTopics(List<TopicSpec> topics, boolean validateOnly, int timeoutMs) {
    throw unexpected("createTopics");
  }

  @Override
  public void deleteTopics(List<String> topics, int timeoutMs) {
    throw unexpected("deleteTopics");
  }

  @Override
  public void createPartitions(List<PartitionsSpec> topicPartitions, boolean validateOnly, int timeoutMs) {
    throw unexpected("createPartitions");
  }

  @Override
  public DescribeConfigsResponse describeConfigs(List<ConfigResourceRef> resources, boolean includeSynonyms) {
    throw unexpected("describeConfigs");
  }

  @Override
  public AlterConfigsResponse alterConfigs(List<ConfigResourceUpdate> resources, boolean validateOnly) {
    throw unexpected("alterConfigs");
  }

  @Override
  public void createAcls(List<AclRule> acl) {
    throw unexpected("createAcls");
  }

  @Override
  public DescribeAclsResponse describeAcls(AclRuleFilter filter) {
    throw unexpected("describeAcls");
  }

  @Override
  public DeleteAclsResponse deleteAcls(List<AclRuleFilter> filters) {
    throw unexpected("deleteAcls");
  }

  @Override
  public ListGroupsResult listGroups() {
    throw unexpected("listGroups");
  }

  @Override
  public List<GroupDeletionResult> deleteGroups(List<String> groupIds) {
    throw unexpected("deleteGroups");
  }

  @Override
  public List<TopicMetadata> metadata(List<String> topics) {
    throw unexpected("metadata");
  }

  @Override
  public List<TopicOffsets> offsetFetch(String groupId, String topic, List<Integer> partitions) {
    throw unexpected("offsetFetch");
  }

  private UnsupportedOperationException unexpected(String call) {
    return new UnsupportedOperationException("Unexpected " + call + " on broker " + nodeId);
  }
}
