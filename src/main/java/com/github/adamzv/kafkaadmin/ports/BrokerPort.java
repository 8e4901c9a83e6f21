package com.github.adamzv.kafkaadmin.ports;

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
import com.github.adamzv.kafkaadmin.domain.ProtocolException;
import com.github.adamzv.kafkaadmin.domain.TopicMetadata;
import com.github.adamzv.kafkaadmin.domain.TopicOffsets;
import com.github.adamzv.kafkaadmin.domain.TopicSpec;
import java.util.List;

/**
 * Requests addressed to one broker. Every method either returns its payload or throws a
 * {@link ProtocolException} whose type tells the caller what went wrong.
 */
public interface BrokerPort {

  int nodeId();

  void createTopics(List<TopicSpec> topics, boolean validateOnly, int timeoutMs) throws ProtocolException;

  void deleteTopics(List<String> topics, int timeoutMs) throws ProtocolException;

  void createPartitions(List<PartitionsSpec> topicPartitions, boolean validateOnly, int timeoutMs)
      throws ProtocolException;

  DescribeConfigsResponse describeConfigs(List<ConfigResourceRef> resources, boolean includeSynonyms)
      throws ProtocolException;

  AlterConfigsResponse alterConfigs(List<ConfigResourceUpdate> resources, boolean validateOnly)
      throws ProtocolException;

  void createAcls(List<AclRule> acl) throws ProtocolException;

  DescribeAclsResponse describeAcls(AclRuleFilter filter) throws ProtocolException;

  DeleteAclsResponse deleteAcls(List<AclRuleFilter> filters) throws ProtocolException;

  ListGroupsResult listGroups() throws ProtocolException;

  /**
   * Deletes groups this broker coordinates. Per-group failures are reported in the result
   * list, not thrown.
   */
  List<GroupDeletionResult> deleteGroups(List<String> groupIds) throws ProtocolException;

  List<TopicMetadata> metadata(List<String> topics) throws ProtocolException;

  List<TopicOffsets> offsetFetch(String groupId, String topic, List<Integer> partitions)
      throws ProtocolException;
}
