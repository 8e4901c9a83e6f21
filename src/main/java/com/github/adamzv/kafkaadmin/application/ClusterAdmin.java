package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.AclFilter;
import com.github.adamzv.kafkaadmin.domain.AdminEvent;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsRequest;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.BrokerNode;
import com.github.adamzv.kafkaadmin.domain.ClusterDescription;
import com.github.adamzv.kafkaadmin.domain.ClusterMetadata;
import com.github.adamzv.kafkaadmin.domain.CreateAclsRequest;
import com.github.adamzv.kafkaadmin.domain.CreatePartitionsRequest;
import com.github.adamzv.kafkaadmin.domain.CreateTopicsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteAclsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteAclsResponse;
import com.github.adamzv.kafkaadmin.domain.DeleteGroupsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteTopicsRequest;
import com.github.adamzv.kafkaadmin.domain.DescribeAclsResponse;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsRequest;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.FetchOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.GroupDeletionResult;
import com.github.adamzv.kafkaadmin.domain.InstrumentationEvent;
import com.github.adamzv.kafkaadmin.domain.ListGroupsResult;
import com.github.adamzv.kafkaadmin.domain.PartitionOffset;
import com.github.adamzv.kafkaadmin.domain.PartitionWatermarks;
import com.github.adamzv.kafkaadmin.domain.Problem;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.ProtocolException;
import com.github.adamzv.kafkaadmin.domain.ResetOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.SetOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.TopicMetadata;
import com.github.adamzv.kafkaadmin.domain.TopicsMetadata;
import com.github.adamzv.kafkaadmin.ports.ClusterPort;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for every admin operation. Validation, retries and routing live in the
 * per-concern services; this class owns the connection lifecycle and the event listeners.
 */
@Component
public class ClusterAdmin {

  private static final Logger log = LoggerFactory.getLogger(ClusterAdmin.class);

  private final ClusterPort cluster;
  private final InstrumentationEmitter emitter;
  private final EnumValidator validator;
  private final TopicAdministration topics;
  private final ConfigAdministration configs;
  private final AclAdministration acls;
  private final GroupAdministration groups;
  private final OffsetCoordinator offsets;

  public ClusterAdmin(ClusterPort cluster,
                      InstrumentationEmitter emitter,
                      EnumValidator validator,
                      TopicAdministration topics,
                      ConfigAdministration configs,
                      AclAdministration acls,
                      GroupAdministration groups,
                      OffsetCoordinator offsets) {
    this.cluster = cluster;
    this.emitter = emitter;
    this.validator = validator;
    this.topics = topics;
    this.configs = configs;
    this.acls = acls;
    this.groups = groups;
    this.offsets = offsets;
  }

  public void connect() {
    cluster.connect();
    log.info("admin_connected");
    emitter.emit(AdminEvent.CONNECT, Map.of());
  }

  public void disconnect() {
    cluster.disconnect();
    log.info("admin_disconnected");
    emitter.emit(AdminEvent.DISCONNECT, Map.of());
  }

  public List<String> listTopics() {
    return cluster.metadata(List.of()).topicMetadata().stream()
        .map(TopicMetadata::topic)
        .toList();
  }

  public boolean createTopics(CreateTopicsRequest request) {
    return topics.createTopics(request);
  }

  public void deleteTopics(DeleteTopicsRequest request) {
    topics.deleteTopics(request);
  }

  public void createPartitions(CreatePartitionsRequest request) {
    topics.createPartitions(request);
  }

  /**
   * Describes the given topics, or every tracked topic when {@code topicNames} is null. The
   * given topics are tracked from then on.
   *
   * @deprecated use {@link #fetchTopicMetadata(List)}, which does not change the tracked set
   */
  @Deprecated
  public TopicsMetadata getTopicMetadata(List<String> topicNames) {
    if (topicNames != null) {
      for (String topic : topicNames) {
        validator.topic(topic);
        try {
          cluster.addTargetTopic(topic);
        } catch (ProblemException ex) {
          throw withMessage(ex, "Failed to add target topic " + topic + ": " + ex.getMessage());
        }
      }
    }

    cluster.refreshMetadataIfNecessary();
    List<String> targets = topicNames != null ? topicNames : new ArrayList<>(cluster.targetTopics());

    return new TopicsMetadata(targets.stream()
        .map(topic -> new TopicMetadata(topic, cluster.findTopicPartitionMetadata(topic)))
        .toList());
  }

  /**
   * Metadata of the given topics, straight from the cluster. An empty or null list means
   * every topic.
   */
  public TopicsMetadata fetchTopicMetadata(List<String> topicNames) {
    List<String> validTopics = validator.topics(topicNames);
    return new TopicsMetadata(cluster.metadata(validTopics).topicMetadata());
  }

  public ClusterDescription describeCluster() {
    ClusterMetadata metadata = cluster.describeCluster();
    List<BrokerNode> brokers = metadata.brokers().stream()
        .map(node -> new BrokerNode(node.nodeId(), node.host(), node.port()))
        .toList();
    Integer controller = metadata.hasController() ? metadata.controllerId() : null;
    return new ClusterDescription(brokers, controller, metadata.clusterId());
  }

  public List<PartitionOffset> fetchOffsets(FetchOffsetsRequest request) {
    return offsets.fetchOffsets(request);
  }

  public List<PartitionWatermarks> fetchTopicOffsets(String topic) {
    return offsets.fetchTopicOffsets(topic);
  }

  public void setOffsets(SetOffsetsRequest request) {
    offsets.setOffsets(request);
  }

  public void resetOffsets(ResetOffsetsRequest request) {
    offsets.resetOffsets(request);
  }

  public DescribeConfigsResponse describeConfigs(DescribeConfigsRequest request) {
    return configs.describeConfigs(request);
  }

  public AlterConfigsResponse alterConfigs(AlterConfigsRequest request) {
    return configs.alterConfigs(request);
  }

  public ListGroupsResult listGroups() {
    return groups.listGroups();
  }

  public List<GroupDeletionResult> deleteGroups(DeleteGroupsRequest request) {
    return groups.deleteGroups(request == null ? null : request.groupIds());
  }

  public DescribeAclsResponse describeAcls(AclFilter filter) {
    return acls.describeAcls(filter);
  }

  public DeleteAclsResponse deleteAcls(DeleteAclsRequest request) {
    return acls.deleteAcls(request);
  }

  public boolean createAcls(CreateAclsRequest request) {
    return acls.createAcls(request);
  }

  /**
   * Registers a listener for one of the {@link AdminEvent} names.
   *
   * @return a handle that removes the listener
   */
  public Runnable on(String eventName, Consumer<InstrumentationEvent> listener) {
    AdminEvent event = AdminEvent.fromEventName(eventName);
    if (event == null) {
      throw Problems.invalidArgument(
          "Event name should be one of " + AdminEvent.describeKeys(),
          Map.of("eventName", String.valueOf(eventName))
      );
    }
    if (listener == null) {
      throw Problems.invalidArgument("Listener is required", Map.of("eventName", eventName));
    }
    return emitter.addListener(event, listener);
  }

  private static ProblemException withMessage(ProblemException ex, String message) {
    if (ex instanceof ProtocolException protocol) {
      return Problems.protocol(protocol.type(), message, ex.problem().details());
    }
    Problem problem = ex.problem();
    return new ProblemException(
        new Problem(ex.code(), message, problem == null ? Map.of() : problem.details()),
        ex
    );
  }
}
