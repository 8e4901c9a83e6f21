package com.github.adamzv.kafkaadmin.adapters.kafka;

import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import com.github.adamzv.kafkaadmin.domain.BrokerNode;
import com.github.adamzv.kafkaadmin.domain.ClusterMetadata;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.GroupDescription;
import com.github.adamzv.kafkaadmin.domain.GroupListing;
import com.github.adamzv.kafkaadmin.domain.GroupState;
import com.github.adamzv.kafkaadmin.domain.PartitionMetadata;
import com.github.adamzv.kafkaadmin.domain.PartitionOffset;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.ProtocolException;
import com.github.adamzv.kafkaadmin.domain.SeekTarget;
import com.github.adamzv.kafkaadmin.domain.TopicMetadata;
import com.github.adamzv.kafkaadmin.domain.TopicOffsets;
import com.github.adamzv.kafkaadmin.domain.TopicOffsetsQuery;
import com.github.adamzv.kafkaadmin.ports.BrokerPort;
import com.github.adamzv.kafkaadmin.ports.ClusterPort;
import com.github.adamzv.kafkaadmin.support.KafkaProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.ConsumerGroupDescription;
import org.apache.kafka.clients.admin.ConsumerGroupListing;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.apache.kafka.clients.admin.DescribeTopicsOptions;
import org.apache.kafka.clients.admin.ListOffsetsResult;
import org.apache.kafka.clients.admin.ListTopicsOptions;
import org.apache.kafka.clients.admin.OffsetSpec;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.utils.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ClusterPort} on top of one shared {@link Admin} client.
 *
 * <p>Metadata is cached for the tracked topics only and refreshed on demand. The admin client
 * routes every request itself, so a {@link KafkaBrokerHandle} mostly records which node the
 * request was meant for.
 */
@Component
public class KafkaClusterAdapter implements ClusterPort, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(KafkaClusterAdapter.class);

  private final KafkaProperties kafkaProperties;
  private final AdminTimeouts timeouts;
  private final Time time;
  private final AdminCalls calls;
  private final Set<String> targetTopics = ConcurrentHashMap.newKeySet();

  private volatile Admin admin;
  private volatile Snapshot snapshot;
  private volatile GroupIndex groupIndex;

  public KafkaClusterAdapter(KafkaProperties kafkaProperties, AdminTimeouts timeouts, Time time) {
    this.kafkaProperties = kafkaProperties;
    this.timeouts = timeouts;
    this.time = time;
    this.calls = new AdminCalls(kafkaProperties.bootstrapServers(), timeouts.request());
  }

  @Override
  public synchronized void connect() {
    if (admin != null) {
      return;
    }
    Properties props = new Properties();
    int timeoutMs = calls.timeoutMs();
    props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.bootstrapServers());
    props.put(AdminClientConfig.CLIENT_ID_CONFIG, kafkaProperties.clientId());
    props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
    props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);
    props.put(AdminClientConfig.METADATA_MAX_AGE_CONFIG, Math.toIntExact(timeouts.metadataMaxAge().toMillis()));
    try {
      admin = Admin.create(props);
    } catch (KafkaException ex) {
      throw Problems.kafkaUnavailable(
          "Could not create Kafka admin client",
          Map.of("bootstrapServers", kafkaProperties.bootstrapServers(), "message", String.valueOf(ex.getMessage()))
      );
    }

    try {
      refreshMetadata();
    } catch (ProblemException ex) {
      disconnect();
      throw ex;
    }
    log.info("kafka_admin_connected bootstrapServers={} clientId={}",
        kafkaProperties.bootstrapServers(), kafkaProperties.clientId());
  }

  @Override
  public synchronized void disconnect() {
    Admin current = admin;
    admin = null;
    snapshot = null;
    groupIndex = null;
    if (current != null) {
      current.close(calls.timeout());
      log.info("kafka_admin_disconnected bootstrapServers={}", kafkaProperties.bootstrapServers());
    }
  }

  @Override
  public void close() {
    disconnect();
  }

  @Override
  public ClusterMetadata metadata(List<String> topics) {
    List<String> requested = topics == null ? List.of() : topics;
    List<String> names = requested.isEmpty() ? allTopicNames() : requested;
    return describe(names, false);
  }

  @Override
  public ClusterMetadata describeCluster() {
    return describe(List.of(), false);
  }

  /**
   * Tracked topics that no longer exist are untracked rather than failing the refresh.
   */
  @Override
  public void refreshMetadata() {
    snapshot = new Snapshot(describe(new ArrayList<>(new TreeSet<>(targetTopics)), true), time.milliseconds());
    groupIndex = new GroupIndex(this::loadGroupsByCoordinator);
  }

  @Override
  public void refreshMetadataIfNecessary() {
    Snapshot current = snapshot;
    boolean stale = current == null
        || time.milliseconds() - current.fetchedAtMs() >= timeouts.metadataMaxAge().toMillis()
        || !current.topics().keySet().containsAll(targetTopics);
    if (stale) {
      refreshMetadata();
    }
  }

  @Override
  public void addTargetTopic(String topic) {
    if (!targetTopics.add(topic)) {
      return;
    }
    try {
      refreshMetadata();
    } catch (ProblemException ex) {
      targetTopics.remove(topic);
      throw ex;
    }
    if (!snapshot.topics().containsKey(topic)) {
      targetTopics.remove(topic);
      throw Problems.protocol(
          ErrorType.UNKNOWN_TOPIC_OR_PARTITION,
          "This server does not host this topic-partition",
          Map.of("topic", topic)
      );
    }
  }

  @Override
  public void removeTargetTopic(String topic) {
    targetTopics.remove(topic);
  }

  @Override
  public Set<String> targetTopics() {
    return Collections.unmodifiableSet(targetTopics);
  }

  @Override
  public List<PartitionMetadata> findTopicPartitionMetadata(String topic) {
    Snapshot current = snapshot;
    if (current == null) {
      return List.of();
    }
    TopicMetadata metadata = current.topics().get(topic);
    return metadata == null ? List.of() : metadata.partitionMetadata();
  }

  @Override
  public BrokerPort findControllerBroker() {
    ClusterMetadata metadata = currentSnapshot().metadata();
    if (!metadata.hasController()) {
      throw Problems.protocol(
          ErrorType.NOT_CONTROLLER,
          "No controller is currently available",
          Map.of("clusterId", String.valueOf(metadata.clusterId()))
      );
    }
    return handle(metadata.controllerId());
  }

  @Override
  public BrokerPort findGroupCoordinator(String groupId) {
    ConsumerGroupDescription description = describeGroupInternal(groupId, "findGroupCoordinator");
    Node coordinator = description.coordinator();
    if (coordinator == null || coordinator.isEmpty()) {
      throw Problems.protocol(
          ErrorType.COORDINATOR_NOT_AVAILABLE,
          "The coordinator is not available",
          Map.of("groupId", groupId)
      );
    }
    return handle(coordinator.id());
  }

  @Override
  public BrokerPort findBroker(int nodeId) {
    boolean known = currentSnapshot().metadata().brokers().stream()
        .anyMatch(node -> node.nodeId() == nodeId);
    if (!known) {
      throw Problems.notFound("Broker " + nodeId + " not found in the cached metadata", Map.of("nodeId", nodeId));
    }
    return handle(nodeId);
  }

  @Override
  public List<Integer> brokerNodeIds() {
    return currentSnapshot().metadata().brokers().stream()
        .map(BrokerNode::nodeId)
        .toList();
  }

  @Override
  public long defaultOffset(boolean fromBeginning) {
    return fromBeginning ? SeekTarget.EARLIEST : SeekTarget.LATEST;
  }

  @Override
  public List<TopicOffsets> fetchTopicsOffset(List<TopicOffsetsQuery> queries) {
    List<TopicOffsets> result = new ArrayList<>(queries.size());
    for (TopicOffsetsQuery query : queries) {
      Map<TopicPartition, OffsetSpec> specs = new HashMap<>();
      for (int partition : query.partitions()) {
        specs.put(
            new TopicPartition(query.topic(), partition),
            query.fromBeginning() ? OffsetSpec.earliest() : OffsetSpec.latest()
        );
      }
      Map<TopicPartition, ListOffsetsResult.ListOffsetsResultInfo> offsets = calls.await(
          admin().listOffsets(specs).all(),
          "listOffsets",
          Map.of("topic", query.topic(), "fromBeginning", query.fromBeginning())
      );

      List<PartitionOffset> partitions = query.partitions().stream()
          .map(partition -> {
            ListOffsetsResult.ListOffsetsResultInfo info = offsets.get(new TopicPartition(query.topic(), partition));
            return new PartitionOffset(partition, info == null ? -1L : info.offset(), null);
          })
          .toList();
      result.add(new TopicOffsets(query.topic(), partitions));
    }
    return List.copyOf(result);
  }

  GroupDescription describeGroup(String groupId) {
    ConsumerGroupDescription description = describeGroupInternal(groupId, "describeGroup");
    GroupState state = description.state() == null
        ? GroupState.UNKNOWN
        : GroupState.parse(description.state().toString());
    return new GroupDescription(description.groupId(), state);
  }

  AdminCalls calls() {
    return calls;
  }

  Admin admin() {
    Admin current = admin;
    if (current == null) {
      throw Problems.kafkaUnavailable(
          "Kafka admin client is not connected",
          Map.of("bootstrapServers", kafkaProperties.bootstrapServers())
      );
    }
    return current;
  }

  private KafkaBrokerHandle handle(int nodeId) {
    return new KafkaBrokerHandle(nodeId, admin(), calls, currentGroupIndex());
  }

  private GroupIndex currentGroupIndex() {
    GroupIndex current = groupIndex;
    if (current == null) {
      current = new GroupIndex(this::loadGroupsByCoordinator);
      groupIndex = current;
    }
    return current;
  }

  private Map<Integer, List<GroupListing>> loadGroupsByCoordinator() {
    Admin client = admin();
    Collection<ConsumerGroupListing> listings = calls.await(
        client.listConsumerGroups().all(),
        "listGroups",
        Map.of()
    );
    if (listings.isEmpty()) {
      return Map.of();
    }

    Map<String, ConsumerGroupDescription> descriptions = calls.await(
        client.describeConsumerGroups(listings.stream().map(ConsumerGroupListing::groupId).toList()).all(),
        "listGroups",
        Map.of("groups", listings.size())
    );

    Map<Integer, List<GroupListing>> byCoordinator = new HashMap<>();
    for (ConsumerGroupListing listing : listings) {
      ConsumerGroupDescription description = descriptions.get(listing.groupId());
      if (description == null || description.coordinator() == null || description.coordinator().isEmpty()) {
        continue;
      }
      byCoordinator
          .computeIfAbsent(description.coordinator().id(), id -> new ArrayList<>())
          .add(new GroupListing(listing.groupId(), listing.isSimpleConsumerGroup() ? "" : "consumer"));
    }
    byCoordinator.replaceAll((id, groups) -> List.copyOf(groups));
    return byCoordinator;
  }

  private Snapshot currentSnapshot() {
    Snapshot current = snapshot;
    if (current == null) {
      refreshMetadata();
      current = snapshot;
    }
    return current;
  }

  private ConsumerGroupDescription describeGroupInternal(String groupId, String operation) {
    Map<String, ConsumerGroupDescription> descriptions = calls.await(
        admin().describeConsumerGroups(List.of(groupId)).all(),
        operation,
        Map.of("groupId", groupId)
    );
    ConsumerGroupDescription description = descriptions.get(groupId);
    if (description == null) {
      throw Problems.protocol(ErrorType.GROUP_ID_NOT_FOUND, "The group id does not exist", Map.of("groupId", groupId));
    }
    return description;
  }

  private List<String> allTopicNames() {
    ListTopicsOptions options = new ListTopicsOptions()
        .listInternal(true)
        .timeoutMs(calls.timeoutMs());
    Set<String> names = calls.await(admin().listTopics(options).names(), "listTopics", Map.of());
    return names.stream().sorted().toList();
  }

  private ClusterMetadata describe(List<String> topics, boolean untrackMissing) {
    Admin client = admin();
    DescribeClusterResult cluster = client.describeCluster(
        new DescribeClusterOptions().timeoutMs(calls.timeoutMs())
    );
    Collection<Node> nodes = calls.await(cluster.nodes(), "describeCluster", Map.of());
    Node controller = calls.await(cluster.controller(), "describeCluster", Map.of());
    String clusterId = calls.await(cluster.clusterId(), "describeCluster", Map.of());

    List<BrokerNode> brokers = nodes.stream()
        .sorted(Comparator.comparingInt(Node::id))
        .map(node -> new BrokerNode(node.id(), node.host(), node.port()))
        .toList();
    int controllerId = controller == null || controller.isEmpty()
        ? ClusterMetadata.NO_CONTROLLER_ID
        : controller.id();

    List<TopicMetadata> topicMetadata = List.of();
    if (!topics.isEmpty()) {
      DescribeTopicsOptions options = new DescribeTopicsOptions().timeoutMs(calls.timeoutMs());
      Map<String, TopicDescription> descriptions = untrackMissing
          ? describeTracked(client, topics, options)
          : calls.await(
              client.describeTopics(topics, options).allTopicNames(),
              "describeTopics",
              Map.of("topics", List.copyOf(topics))
          );
      topicMetadata = topics.stream()
          .map(descriptions::get)
          .filter(Objects::nonNull)
          .map(AdminCalls::toTopicMetadata)
          .toList();
    }
    return new ClusterMetadata(brokers, controllerId, clusterId, topicMetadata);
  }

  private Map<String, TopicDescription> describeTracked(Admin client,
                                                        List<String> topics,
                                                        DescribeTopicsOptions options) {
    Map<String, KafkaFuture<TopicDescription>> futures = client.describeTopics(topics, options).topicNameValues();
    Map<String, TopicDescription> descriptions = new HashMap<>();
    for (String topic : topics) {
      try {
        descriptions.put(topic, calls.await(futures.get(topic), "describeTopics", Map.of("topic", topic)));
      } catch (ProtocolException ex) {
        if (ex.type() != ErrorType.UNKNOWN_TOPIC_OR_PARTITION) {
          throw ex;
        }
        targetTopics.remove(topic);
        log.warn("tracked_topic_missing topic={} action=untracked", topic);
      }
    }
    return descriptions;
  }

  private record Snapshot(ClusterMetadata metadata, Map<String, TopicMetadata> topics, long fetchedAtMs) {

    Snapshot(ClusterMetadata metadata, long fetchedAtMs) {
      this(metadata, index(metadata), fetchedAtMs);
    }

    private static Map<String, TopicMetadata> index(ClusterMetadata metadata) {
      Map<String, TopicMetadata> byTopic = new HashMap<>();
      for (TopicMetadata topic : metadata.topicMetadata()) {
        byTopic.put(topic.topic(), topic);
      }
      return Map.copyOf(byTopic);
    }
  }
}
