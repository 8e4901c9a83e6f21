package com.github.adamzv.kafkaadmin.adapters.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkaadmin.application.ClusterAdmin;
import com.github.adamzv.kafkaadmin.domain.AclFilter;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsRequest;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.ClusterDescription;
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
import com.github.adamzv.kafkaadmin.domain.ListGroupsResult;
import com.github.adamzv.kafkaadmin.domain.PartitionOffset;
import com.github.adamzv.kafkaadmin.domain.PartitionWatermarks;
import com.github.adamzv.kafkaadmin.domain.Problem;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.ResetOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.SetOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.TopicsMetadata;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Component;

@Component
public class AdminTools {

  private static final Logger log = LoggerFactory.getLogger(AdminTools.class);

  private final ClusterAdmin admin;
  private final ObjectMapper objectMapper;
  private final MeterRegistry meterRegistry;

  public AdminTools(ClusterAdmin admin, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
    this.admin = admin;
    this.objectMapper = objectMapper;
    this.meterRegistry = meterRegistry;
  }

  @Tool(name = "listTopics", description = "List the names of every topic in the cluster, internal topics included")
  public List<String> listTopics() {
    return invoke(
        "listTopics",
        admin::listTopics,
        topics -> new ToolTelemetry(topics.size(), Map.of()),
        Map.of()
    );
  }

  @Tool(name = "describeCluster", description = """
      Describe the cluster.

      Returns:
      - brokers: list of {nodeId, host, port}
      - controller: node id of the current controller, or null when there is none
      - clusterId: the cluster id
      """)
  public ClusterDescription describeCluster() {
    return invoke(
        "describeCluster",
        admin::describeCluster,
        cluster -> new ToolTelemetry(
            cluster.brokers().size(),
            contextOf("controller", cluster.controller(), "clusterId", cluster.clusterId())
        ),
        Map.of()
    );
  }

  @Tool(name = "fetchTopicMetadata", description = """
      Fetch partition metadata (leader, replicas, isr) for the given topics.

      Parameters:
      - topics: topic names, or an empty list for every topic
      """)
  public TopicsMetadata fetchTopicMetadata(TopicsInput input) {
    List<String> topics = input != null ? input.topics() : null;
    return invoke(
        "fetchTopicMetadata",
        () -> admin.fetchTopicMetadata(topics),
        metadata -> new ToolTelemetry(metadata.topics().size(), Map.of()),
        contextOf("topics", topics)
    );
  }

  @Tool(name = "createTopics", description = """
      Create topics. All changes go through the controller and are retried while it moves.

      Parameters:
      - topics: list of {topic, numPartitions, replicationFactor, replicaAssignment, configEntries}
        * replicaAssignment: optional list of {partition, replicas}
        * configEntries: optional list of {name, value}
      - validateOnly: only validate the request on the broker (default false)
      - timeout: broker side timeout in ms (default configured server-side)
      - waitForLeaders: wait until every new partition has a leader (default true)

      Returns: true when the topics were created, false when they already existed
      """)
  public boolean createTopics(CreateTopicsRequest request) {
    return invoke(
        "createTopics",
        () -> admin.createTopics(request),
        created -> new ToolTelemetry(1L, contextOf("created", created)),
        contextOf(
            "topicCount", request != null && request.topics() != null ? request.topics().size() : null,
            "validateOnly", request != null ? request.validateOnly() : null
        )
    );
  }

  @Tool(name = "deleteTopics", description = """
      Delete topics. Requires "delete.topic.enable=true" on the brokers.

      Parameters:
      - topics: topic names
      - timeout: broker side timeout in ms (default configured server-side)
      """)
  public String deleteTopics(DeleteTopicsRequest request) {
    return invoke(
        "deleteTopics",
        () -> {
          admin.deleteTopics(request);
          return "deleted";
        },
        ignored -> new ToolTelemetry(request.topics().size(), Map.of()),
        contextOf("topics", request != null ? request.topics() : null)
    );
  }

  @Tool(name = "createPartitions", description = """
      Increase the partition count of topics.

      Parameters:
      - topicPartitions: list of {topic, count, assignments}
        * count: the new total number of partitions
        * assignments: optional replica lists for the new partitions
      - validateOnly: only validate the request on the broker (default false)
      - timeout: broker side timeout in ms (default configured server-side)
      """)
  public String createPartitions(CreatePartitionsRequest request) {
    return invoke(
        "createPartitions",
        () -> {
          admin.createPartitions(request);
          return "created";
        },
        ignored -> new ToolTelemetry(request.topicPartitions().size(), Map.of()),
        contextOf("validateOnly", request != null ? request.validateOnly() : null)
    );
  }

  @Tool(name = "describeConfigs", description = """
      Describe resource configs.

      Parameters:
      - resources: list of {type, name, configNames}
        * type: TOPIC, BROKER or BROKER_LOGGER (or the numeric code 2, 4, 8)
        * configNames: optional, limits the result to these entries
      - includeSynonyms: also return config synonyms (default false)
      """)
  public DescribeConfigsResponse describeConfigs(DescribeConfigsRequest request) {
    return invoke(
        "describeConfigs",
        () -> admin.describeConfigs(request),
        response -> new ToolTelemetry(response.resources().size(), Map.of()),
        contextOf("resourceCount", request != null && request.resources() != null ? request.resources().size() : null)
    );
  }

  @Tool(name = "alterConfigs", description = """
      Set resource config values. Entries not listed keep their current value.

      Parameters:
      - resources: list of {type, name, configEntries: [{name, value}]}
      - validateOnly: only validate the request on the broker (default false)
      """)
  public AlterConfigsResponse alterConfigs(AlterConfigsRequest request) {
    return invoke(
        "alterConfigs",
        () -> admin.alterConfigs(request),
        response -> new ToolTelemetry(response.resources().size(), Map.of()),
        contextOf("resourceCount", request != null && request.resources() != null ? request.resources().size() : null)
    );
  }

  @Tool(name = "createAcls", description = """
      Create ACL entries. The whole batch is validated before anything is sent.

      Parameters:
      - acl: list of {resourceType, resourceName, resourcePatternType, principal, host, operation, permissionType}
        * resourceType: TOPIC, GROUP, CLUSTER, TRANSACTIONAL_ID, DELEGATION_TOKEN
        * resourcePatternType: LITERAL, PREFIXED, MATCH, ANY
        * operation: ALL, READ, WRITE, CREATE, DELETE, ALTER, DESCRIBE, CLUSTER_ACTION, DESCRIBE_CONFIGS, ALTER_CONFIGS, IDEMPOTENT_WRITE
        * permissionType: ALLOW, DENY
      """)
  public boolean createAcls(CreateAclsRequest request) {
    return invoke(
        "createAcls",
        () -> admin.createAcls(request),
        created -> new ToolTelemetry(request.acl().size(), Map.of()),
        contextOf("aclCount", request != null && request.acl() != null ? request.acl().size() : null)
    );
  }

  @Tool(name = "describeAcls", description = """
      Describe the ACL entries matching a filter.

      Parameters: {resourceType, resourceName, resourcePatternType, principal, host, operation, permissionType}
      resourceName, principal and host may be null to match anything.
      """)
  public DescribeAclsResponse describeAcls(AclFilter filter) {
    return invoke(
        "describeAcls",
        () -> admin.describeAcls(filter),
        response -> new ToolTelemetry(response.resources().size(), Map.of()),
        contextOf("resourceType", filter != null ? filter.resourceType() : null)
    );
  }

  @Tool(name = "deleteAcls", description = """
      Delete the ACL entries matching any of the given filters.

      Parameters:
      - filters: list of ACL filters, same shape as describeAcls
      """)
  public DeleteAclsResponse deleteAcls(DeleteAclsRequest request) {
    return invoke(
        "deleteAcls",
        () -> admin.deleteAcls(request),
        response -> new ToolTelemetry(response.filterResponses().size(), Map.of()),
        contextOf("filterCount", request != null && request.filters() != null ? request.filters().size() : null)
    );
  }

  @Tool(name = "listGroups", description = "List the consumer groups of every broker in the cluster")
  public ListGroupsResult listGroups() {
    return invoke(
        "listGroups",
        admin::listGroups,
        result -> new ToolTelemetry(result.groups().size(), Map.of()),
        Map.of()
    );
  }

  @Tool(name = "deleteGroups", description = """
      Delete consumer groups. Groups that fail on a transient coordinator error are retried;
      groups already deleted are not sent again.

      Parameters:
      - groupIds: group ids to delete

      Returns: one {groupId, errorCode, error} entry per deleted group
      """)
  public List<GroupDeletionResult> deleteGroups(DeleteGroupsRequest request) {
    return invoke(
        "deleteGroups",
        () -> admin.deleteGroups(request),
        results -> new ToolTelemetry(results.size(), Map.of()),
        contextOf("groupIds", request != null ? request.groupIds() : null)
    );
  }

  @Tool(name = "fetchTopicOffsets", description = """
      Fetch the low and high watermark of every partition of a topic.

      Returns: list of {partition, offset, high, low}, where offset equals high
      """)
  public List<PartitionWatermarks> fetchTopicOffsets(TopicInput input) {
    String topic = input != null ? input.topic() : null;
    return invoke(
        "fetchTopicOffsets",
        () -> admin.fetchTopicOffsets(topic),
        offsets -> new ToolTelemetry(offsets.size(), Map.of()),
        contextOf("topic", topic)
    );
  }

  @Tool(name = "fetchOffsets", description = """
      Fetch the committed offsets of a consumer group for one topic.

      Returns: list of {partition, offset, metadata}; offset is -1 when nothing was committed
      """)
  public List<PartitionOffset> fetchOffsets(FetchOffsetsRequest request) {
    return invoke(
        "fetchOffsets",
        () -> admin.fetchOffsets(request),
        offsets -> new ToolTelemetry(offsets.size(), Map.of()),
        contextOf(
            "groupId", request != null ? request.groupId() : null,
            "topic", request != null ? request.topic() : null
        )
    );
  }

  @Tool(name = "setOffsets", description = """
      Move the committed offsets of a consumer group. The group must have no running members.

      Parameters:
      - groupId: consumer group
      - topic: topic name
      - partitions: list of {partition, offset}; offset -2 means earliest and -1 latest
      """)
  public String setOffsets(SetOffsetsRequest request) {
    return invoke(
        "setOffsets",
        () -> {
          admin.setOffsets(request);
          return "committed";
        },
        ignored -> new ToolTelemetry(request.partitions().size(), Map.of()),
        contextOf(
            "groupId", request != null ? request.groupId() : null,
            "topic", request != null ? request.topic() : null
        )
    );
  }

  @Tool(name = "resetOffsets", description = """
      Move every partition of a topic to its latest offset, or earliest when earliest=true.
      The group must have no running members.
      """)
  public String resetOffsets(ResetOffsetsRequest request) {
    return invoke(
        "resetOffsets",
        () -> {
          admin.resetOffsets(request);
          return "committed";
        },
        ignored -> new ToolTelemetry(1L, Map.of()),
        contextOf(
            "groupId", request != null ? request.groupId() : null,
            "topic", request != null ? request.topic() : null,
            "earliest", request != null ? request.earliest() : null
        )
    );
  }

  private <T> T invoke(String tool,
                      Supplier<T> action,
                      Function<T, ToolTelemetry> summarizer,
                      Map<String, Object> requestContext) {
    String requestId = UUID.randomUUID().toString();
    Instant start = Instant.now();
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      T result = action.get();
      Duration duration = Duration.between(start, Instant.now());
      ToolTelemetry telemetry = summarizer.apply(result);
      sample.stop(meterRegistry.timer("kafka_admin_tool_duration_seconds", "tool", tool));
      log.info(
          "admin_call outcome=success requestId={} tool={} durationMs={} count={} context={}",
          requestId,
          tool,
          duration.toMillis(),
          telemetry.count(),
          mergeContexts(requestContext, telemetry.extraContext())
      );
      return result;
    } catch (ProblemException ex) {
      Duration duration = Duration.between(start, Instant.now());
      Problem problem = ex.problem();
      recordError(tool, problem, sample);
      log.warn(
          "admin_call outcome=error requestId={} tool={} durationMs={} code={} message={} context={}",
          requestId,
          tool,
          duration.toMillis(),
          ex.code(),
          ex.getMessage(),
          requestContext
      );
      throw new ToolProblemException(problem, ex, objectMapper);
    }
  }

  private void recordError(String tool, Problem problem, Timer.Sample sample) {
    sample.stop(meterRegistry.timer("kafka_admin_tool_duration_seconds", "tool", tool));
    if (problem != null) {
      meterRegistry.counter(
              "kafka_admin_tool_errors_total",
              "tool", tool,
              "code", problem.code())
          .increment();
    }
  }

  private Map<String, Object> mergeContexts(Map<String, Object> requestContext, Map<String, Object> resultContext) {
    Map<String, Object> merged = new HashMap<>();
    if (requestContext != null) {
      merged.putAll(requestContext);
    }
    if (resultContext != null) {
      merged.putAll(resultContext);
    }
    return merged;
  }

  public record TopicInput(String topic) {}

  public record TopicsInput(List<String> topics) {}

  private record ToolTelemetry(long count, Map<String, Object> extraContext) {}

  private Map<String, Object> contextOf(Object... keyValues) {
    Map<String, Object> context = new HashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      context.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    return context;
  }
}
