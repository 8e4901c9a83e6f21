package com.github.adamzv.kafkaadmin.adapters.kafka;

import com.github.adamzv.kafkaadmin.domain.AclFilterResult;
import com.github.adamzv.kafkaadmin.domain.AclGrant;
import com.github.adamzv.kafkaadmin.domain.AclOperationType;
import com.github.adamzv.kafkaadmin.domain.AclResource;
import com.github.adamzv.kafkaadmin.domain.AclResourceType;
import com.github.adamzv.kafkaadmin.domain.AclRule;
import com.github.adamzv.kafkaadmin.domain.AclRuleFilter;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsResult;
import com.github.adamzv.kafkaadmin.domain.ConfigEntryDescription;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceDescription;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceRef;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceType;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceUpdate;
import com.github.adamzv.kafkaadmin.domain.ConfigSynonym;
import com.github.adamzv.kafkaadmin.domain.DeleteAclsResponse;
import com.github.adamzv.kafkaadmin.domain.DescribeAclsResponse;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.GroupDeletionResult;
import com.github.adamzv.kafkaadmin.domain.ListGroupsResult;
import com.github.adamzv.kafkaadmin.domain.PartitionOffset;
import com.github.adamzv.kafkaadmin.domain.PartitionsSpec;
import com.github.adamzv.kafkaadmin.domain.PermissionType;
import com.github.adamzv.kafkaadmin.domain.ProtocolEnum;
import com.github.adamzv.kafkaadmin.domain.ProtocolException;
import com.github.adamzv.kafkaadmin.domain.ReplicaAssignment;
import com.github.adamzv.kafkaadmin.domain.ResourcePatternType;
import com.github.adamzv.kafkaadmin.domain.TopicMetadata;
import com.github.adamzv.kafkaadmin.domain.TopicOffsets;
import com.github.adamzv.kafkaadmin.domain.TopicSpec;
import com.github.adamzv.kafkaadmin.ports.BrokerPort;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AlterConfigOp;
import org.apache.kafka.clients.admin.AlterConfigsOptions;
import org.apache.kafka.clients.admin.Config;
import org.apache.kafka.clients.admin.CreatePartitionsOptions;
import org.apache.kafka.clients.admin.CreateTopicsOptions;
import org.apache.kafka.clients.admin.DeleteAclsResult;
import org.apache.kafka.clients.admin.DeleteTopicsOptions;
import org.apache.kafka.clients.admin.DescribeConfigsOptions;
import org.apache.kafka.clients.admin.DescribeTopicsOptions;
import org.apache.kafka.clients.admin.ListConsumerGroupOffsetsSpec;
import org.apache.kafka.clients.admin.NewPartitions;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.acl.AccessControlEntry;
import org.apache.kafka.common.acl.AccessControlEntryFilter;
import org.apache.kafka.common.acl.AclBinding;
import org.apache.kafka.common.acl.AclBindingFilter;
import org.apache.kafka.common.acl.AclOperation;
import org.apache.kafka.common.acl.AclPermissionType;
import org.apache.kafka.common.config.ConfigResource;
import org.apache.kafka.common.protocol.Errors;
import org.apache.kafka.common.resource.PatternType;
import org.apache.kafka.common.resource.ResourcePattern;
import org.apache.kafka.common.resource.ResourcePatternFilter;
import org.apache.kafka.common.resource.ResourceType;

/**
 * {@link BrokerPort} addressed to one node. Requests go through the shared admin client, which
 * picks the actual destination from its own metadata.
 */
class KafkaBrokerHandle implements BrokerPort {

  private final int nodeId;
  private final Admin admin;
  private final AdminCalls calls;
  private final GroupIndex groups;

  KafkaBrokerHandle(int nodeId, Admin admin, AdminCalls calls, GroupIndex groups) {
    this.nodeId = nodeId;
    this.admin = admin;
    this.calls = calls;
    this.groups = groups;
  }

  @Override
  public int nodeId() {
    return nodeId;
  }

  @Override
  public void createTopics(List<TopicSpec> topics, boolean validateOnly, int timeoutMs) {
    List<NewTopic> newTopics = topics.stream().map(KafkaBrokerHandle::toNewTopic).toList();
    CreateTopicsOptions options = new CreateTopicsOptions()
        .validateOnly(validateOnly)
        .timeoutMs(timeoutMs);
    calls.await(
        admin.createTopics(newTopics, options).all(),
        "createTopics",
        Map.of("topics", topics.stream().map(TopicSpec::topic).toList(), "nodeId", nodeId)
    );
  }

  @Override
  public void deleteTopics(List<String> topics, int timeoutMs) {
    calls.await(
        admin.deleteTopics(topics, new DeleteTopicsOptions().timeoutMs(timeoutMs)).all(),
        "deleteTopics",
        Map.of("topics", List.copyOf(topics), "nodeId", nodeId)
    );
  }

  @Override
  public void createPartitions(List<PartitionsSpec> topicPartitions, boolean validateOnly, int timeoutMs) {
    Map<String, NewPartitions> partitions = new LinkedHashMap<>();
    for (PartitionsSpec spec : topicPartitions) {
      NewPartitions increase = spec.assignments() == null || spec.assignments().isEmpty()
          ? NewPartitions.increaseTo(spec.count())
          : NewPartitions.increaseTo(spec.count(), spec.assignments());
      partitions.put(spec.topic(), increase);
    }
    CreatePartitionsOptions options = new CreatePartitionsOptions()
        .validateOnly(validateOnly)
        .timeoutMs(timeoutMs);
    calls.await(
        admin.createPartitions(partitions, options).all(),
        "createPartitions",
        Map.of("topics", List.copyOf(partitions.keySet()), "nodeId", nodeId)
    );
  }

  @Override
  public DescribeConfigsResponse describeConfigs(List<ConfigResourceRef> resources, boolean includeSynonyms) {
    Map<ConfigResource, ConfigResourceRef> requested = new LinkedHashMap<>();
    for (ConfigResourceRef resource : resources) {
      requested.put(toConfigResource(resource.type(), resource.name()), resource);
    }
    DescribeConfigsOptions options = new DescribeConfigsOptions()
        .includeSynonyms(includeSynonyms)
        .timeoutMs(calls.timeoutMs());
    Map<ConfigResource, KafkaFuture<Config>> futures = admin.describeConfigs(requested.keySet(), options).values();

    List<ConfigResourceDescription> descriptions = new ArrayList<>(requested.size());
    for (Map.Entry<ConfigResource, ConfigResourceRef> entry : requested.entrySet()) {
      ConfigResourceRef ref = entry.getValue();
      Config config = calls.await(
          futures.get(entry.getKey()),
          "describeConfigs",
          Map.of("resourceType", ref.type().name(), "resourceName", ref.name())
      );
      List<ConfigEntryDescription> entries = config.entries().stream()
          .filter(configEntry -> ref.configNames() == null
              || ref.configNames().isEmpty()
              || ref.configNames().contains(configEntry.name()))
          .map(KafkaBrokerHandle::toEntryDescription)
          .toList();
      descriptions.add(new ConfigResourceDescription(ref.type(), ref.name(), ErrorType.NONE.code(), null, entries));
    }
    return new DescribeConfigsResponse(List.copyOf(descriptions));
  }

  @Override
  public AlterConfigsResponse alterConfigs(List<ConfigResourceUpdate> resources, boolean validateOnly) {
    Map<ConfigResource, Collection<AlterConfigOp>> updates = new LinkedHashMap<>();
    Map<ConfigResource, ConfigResourceUpdate> requested = new LinkedHashMap<>();
    for (ConfigResourceUpdate resource : resources) {
      ConfigResource configResource = toConfigResource(resource.type(), resource.name());
      List<AlterConfigOp> ops = resource.configEntries().stream()
          .map(entry -> new AlterConfigOp(
              new org.apache.kafka.clients.admin.ConfigEntry(entry.name(), entry.value()),
              AlterConfigOp.OpType.SET
          ))
          .toList();
      updates.put(configResource, ops);
      requested.put(configResource, resource);
    }
    AlterConfigsOptions options = new AlterConfigsOptions()
        .validateOnly(validateOnly)
        .timeoutMs(calls.timeoutMs());
    Map<ConfigResource, KafkaFuture<Void>> futures = admin.incrementalAlterConfigs(updates, options).values();

    List<AlterConfigsResult> results = new ArrayList<>(requested.size());
    for (Map.Entry<ConfigResource, ConfigResourceUpdate> entry : requested.entrySet()) {
      ConfigResourceUpdate update = entry.getValue();
      calls.await(
          futures.get(entry.getKey()),
          "alterConfigs",
          Map.of("resourceType", update.type().name(), "resourceName", update.name())
      );
      results.add(new AlterConfigsResult(update.type(), update.name(), ErrorType.NONE.code(), null));
    }
    return new AlterConfigsResponse(List.copyOf(results));
  }

  @Override
  public void createAcls(List<AclRule> acl) {
    List<AclBinding> bindings = acl.stream().map(KafkaBrokerHandle::toBinding).toList();
    calls.await(admin.createAcls(bindings).all(), "createAcls", Map.of("count", bindings.size()));
  }

  @Override
  public DescribeAclsResponse describeAcls(AclRuleFilter filter) {
    Collection<AclBinding> bindings = calls.await(
        admin.describeAcls(toBindingFilter(filter)).values(),
        "describeAcls",
        Map.of("filter", String.valueOf(filter))
    );

    Map<ResourcePattern, List<AclGrant>> byResource = new LinkedHashMap<>();
    for (AclBinding binding : bindings) {
      AccessControlEntry entry = binding.entry();
      byResource.computeIfAbsent(binding.pattern(), pattern -> new ArrayList<>()).add(new AclGrant(
          entry.principal(),
          entry.host(),
          fromCode(AclOperationType.class, entry.operation().code(), AclOperationType.UNKNOWN),
          fromCode(PermissionType.class, entry.permissionType().code(), PermissionType.UNKNOWN)
      ));
    }

    List<AclResource> resources = byResource.entrySet().stream()
        .map(entry -> new AclResource(
            fromCode(AclResourceType.class, entry.getKey().resourceType().code(), AclResourceType.UNKNOWN),
            entry.getKey().name(),
            fromCode(ResourcePatternType.class, entry.getKey().patternType().code(), ResourcePatternType.UNKNOWN),
            List.copyOf(entry.getValue())
        ))
        .toList();
    return new DescribeAclsResponse(resources);
  }

  @Override
  public DeleteAclsResponse deleteAcls(List<AclRuleFilter> filters) {
    List<AclBindingFilter> bindingFilters = filters.stream().map(KafkaBrokerHandle::toBindingFilter).toList();
    Map<AclBindingFilter, KafkaFuture<DeleteAclsResult.FilterResults>> futures =
        admin.deleteAcls(bindingFilters).values();

    List<AclFilterResult> responses = new ArrayList<>(bindingFilters.size());
    for (AclBindingFilter bindingFilter : bindingFilters) {
      DeleteAclsResult.FilterResults results = calls.await(
          futures.get(bindingFilter),
          "deleteAcls",
          Map.of("filter", String.valueOf(bindingFilter))
      );
      responses.add(toFilterResult(results));
    }
    return new DeleteAclsResponse(List.copyOf(responses));
  }

  /**
   * Groups coordinated by this node.
   */
  @Override
  public ListGroupsResult listGroups() {
    return new ListGroupsResult(groups.coordinatedBy(nodeId));
  }

  @Override
  public List<GroupDeletionResult> deleteGroups(List<String> groupIds) {
    Map<String, KafkaFuture<Void>> futures = admin.deleteConsumerGroups(groupIds).deletedGroups();

    List<GroupDeletionResult> results = new ArrayList<>(groupIds.size());
    for (String groupId : groupIds) {
      try {
        calls.await(futures.get(groupId), "deleteGroups", Map.of("groupId", groupId, "nodeId", nodeId));
        results.add(GroupDeletionResult.success(groupId));
      } catch (ProtocolException ex) {
        results.add(GroupDeletionResult.failure(groupId, ex));
      }
    }
    return List.copyOf(results);
  }

  @Override
  public List<TopicMetadata> metadata(List<String> topics) {
    Map<String, TopicDescription> descriptions = calls.await(
        admin.describeTopics(topics, new DescribeTopicsOptions().timeoutMs(calls.timeoutMs())).allTopicNames(),
        "metadata",
        Map.of("topics", List.copyOf(topics), "nodeId", nodeId)
    );
    return topics.stream()
        .filter(descriptions::containsKey)
        .map(topic -> AdminCalls.toTopicMetadata(descriptions.get(topic)))
        .toList();
  }

  @Override
  public List<TopicOffsets> offsetFetch(String groupId, String topic, List<Integer> partitions) {
    List<TopicPartition> topicPartitions = partitions.stream()
        .map(partition -> new TopicPartition(topic, partition))
        .toList();
    ListConsumerGroupOffsetsSpec spec = new ListConsumerGroupOffsetsSpec().topicPartitions(topicPartitions);
    Map<TopicPartition, OffsetAndMetadata> committed = calls.await(
        admin.listConsumerGroupOffsets(Map.of(groupId, spec)).partitionsToOffsetAndMetadata(groupId),
        "offsetFetch",
        Map.of("groupId", groupId, "topic", topic)
    );

    Map<Integer, PartitionOffset> byPartition = new TreeMap<>();
    for (TopicPartition partition : topicPartitions) {
      OffsetAndMetadata offset = committed.get(partition);
      byPartition.put(partition.partition(), offset == null
          ? new PartitionOffset(partition.partition(), -1L, null)
          : new PartitionOffset(partition.partition(), offset.offset(), offset.metadata()));
    }
    return List.of(new TopicOffsets(topic, List.copyOf(byPartition.values())));
  }

  private static NewTopic toNewTopic(TopicSpec spec) {
    NewTopic topic;
    if (spec.replicaAssignment() != null && !spec.replicaAssignment().isEmpty()) {
      Map<Integer, List<Integer>> assignments = new TreeMap<>();
      for (ReplicaAssignment assignment : spec.replicaAssignment()) {
        assignments.put(assignment.partition(), List.copyOf(assignment.replicas()));
      }
      topic = new NewTopic(spec.topic(), assignments);
    } else {
      topic = new NewTopic(
          spec.topic(),
          Optional.ofNullable(spec.numPartitions()),
          Optional.ofNullable(spec.replicationFactor())
      );
    }
    if (spec.configEntries() != null && !spec.configEntries().isEmpty()) {
      Map<String, String> configs = new HashMap<>();
      spec.configEntries().forEach(entry -> configs.put(entry.name(), entry.value()));
      topic.configs(configs);
    }
    return topic;
  }

  private static ConfigResource toConfigResource(ConfigResourceType type, String name) {
    return new ConfigResource(ConfigResource.Type.forId((byte) type.code()), name);
  }

  private static ConfigEntryDescription toEntryDescription(org.apache.kafka.clients.admin.ConfigEntry entry) {
    List<ConfigSynonym> synonyms = entry.synonyms().stream()
        .map(synonym -> new ConfigSynonym(synonym.name(), synonym.value(), synonym.source().name()))
        .toList();
    return new ConfigEntryDescription(
        entry.name(),
        entry.value(),
        entry.isReadOnly(),
        entry.isDefault(),
        entry.isSensitive(),
        entry.source().name(),
        synonyms
    );
  }

  private static AclBinding toBinding(AclRule rule) {
    return new AclBinding(
        new ResourcePattern(
            ResourceType.fromCode((byte) rule.resourceType().code()),
            rule.resourceName(),
            PatternType.fromCode((byte) rule.resourcePatternType().code())
        ),
        new AccessControlEntry(
            rule.principal(),
            rule.host(),
            AclOperation.fromCode((byte) rule.operation().code()),
            AclPermissionType.fromCode((byte) rule.permissionType().code())
        )
    );
  }

  private static AclBindingFilter toBindingFilter(AclRuleFilter filter) {
    return new AclBindingFilter(
        new ResourcePatternFilter(
            ResourceType.fromCode((byte) filter.resourceType().code()),
            filter.resourceName(),
            PatternType.fromCode((byte) filter.resourcePatternType().code())
        ),
        new AccessControlEntryFilter(
            filter.principal(),
            filter.host(),
            AclOperation.fromCode((byte) filter.operation().code()),
            AclPermissionType.fromCode((byte) filter.permissionType().code())
        )
    );
  }

  private static AclRule toRule(AclBinding binding) {
    return new AclRule(
        fromCode(AclResourceType.class, binding.pattern().resourceType().code(), AclResourceType.UNKNOWN),
        binding.pattern().name(),
        fromCode(ResourcePatternType.class, binding.pattern().patternType().code(), ResourcePatternType.UNKNOWN),
        binding.entry().principal(),
        binding.entry().host(),
        fromCode(AclOperationType.class, binding.entry().operation().code(), AclOperationType.UNKNOWN),
        fromCode(PermissionType.class, binding.entry().permissionType().code(), PermissionType.UNKNOWN)
    );
  }

  private static AclFilterResult toFilterResult(DeleteAclsResult.FilterResults results) {
    List<AclRule> matching = new ArrayList<>();
    for (DeleteAclsResult.FilterResult result : results.values()) {
      if (result.exception() != null) {
        Errors error = Errors.forException(result.exception());
        return new AclFilterResult(error.code(), result.exception().getMessage(), List.of());
      }
      matching.add(toRule(result.binding()));
    }
    return new AclFilterResult(ErrorType.NONE.code(), null, List.copyOf(matching));
  }

  private static <E extends Enum<E> & ProtocolEnum> E fromCode(Class<E> type, int code, E fallback) {
    E member = ProtocolEnum.fromCode(type, code);
    return member == null ? fallback : member;
  }
}
