package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import com.github.adamzv.kafkaadmin.domain.CreatePartitionsRequest;
import com.github.adamzv.kafkaadmin.domain.CreateTopicsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteTopicsRequest;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.PartitionMetadata;
import com.github.adamzv.kafkaadmin.domain.PartitionsSpec;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.ProtocolException;
import com.github.adamzv.kafkaadmin.domain.TopicMetadata;
import com.github.adamzv.kafkaadmin.domain.TopicSpec;
import com.github.adamzv.kafkaadmin.ports.BrokerPort;
import com.github.adamzv.kafkaadmin.ports.ClusterPort;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Topic and partition changes. All of them go to the controller broker, which is looked up
 * again on every attempt.
 */
@Component
public class TopicAdministration {

  static final String LEADER_WAIT_TIMEOUT_MESSAGE = "Timed out while waiting for topic leaders";
  static final String DELETE_TIMEOUT_GUIDANCE =
      "Could not delete topics, check if \"delete.topic.enable\" is set to \"true\" "
          + "(the default value is \"false\") or increase the timeout";

  private final ClusterPort cluster;
  private final RetryOrchestrator retry;
  private final EnumValidator validator;
  private final ConditionWaiter waiter;
  private final AdminTimeouts timeouts;

  public TopicAdministration(ClusterPort cluster,
                             RetryOrchestrator retry,
                             EnumValidator validator,
                             ConditionWaiter waiter,
                             AdminTimeouts timeouts) {
    this.cluster = cluster;
    this.retry = retry;
    this.validator = validator;
    this.waiter = waiter;
    this.timeouts = timeouts;
  }

  /**
   * @return {@code true} when the topics were created, {@code false} when they already existed
   */
  public boolean createTopics(CreateTopicsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid topics array null", Map.of());
    }
    List<TopicSpec> topics = validator.createTopics(request.topics());
    boolean validateOnly = Boolean.TRUE.equals(request.validateOnly());
    boolean waitForLeaders = request.waitForLeaders() == null || request.waitForLeaders();
    int timeoutMs = timeoutMs(request.timeout());
    List<String> topicNames = topics.stream().map(TopicSpec::topic).toList();

    RetryStrategy<Boolean> strategy = RetryStrategy.<Boolean>builder("Could not create topics")
        .retryOn(ErrorType.NOT_CONTROLLER)
        .tolerate(ErrorType.TOPIC_ALREADY_EXISTS, false)
        .build();

    return retry.execute(strategy, context -> {
      cluster.refreshMetadata();
      BrokerPort broker = cluster.findControllerBroker();
      broker.createTopics(topics, validateOnly, timeoutMs);

      if (waitForLeaders && !validateOnly) {
        waiter.waitFor(
            () -> leadersElected(broker, topicNames),
            timeouts.leaderWaitDelay(),
            timeouts.leaderWaitMax(),
            LEADER_WAIT_TIMEOUT_MESSAGE
        );
      }
      return true;
    });
  }

  public void deleteTopics(DeleteTopicsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid topics array null", Map.of());
    }
    List<String> topics = validator.deleteTopics(request.topics());
    int timeoutMs = timeoutMs(request.timeout());

    RetryStrategy<Void> strategy = RetryStrategy.<Void>builder("Could not delete topics")
        .retryOn(ErrorType.NOT_CONTROLLER, ErrorType.UNKNOWN_TOPIC_OR_PARTITION)
        .guidance(ErrorType.REQUEST_TIMED_OUT, DELETE_TIMEOUT_GUIDANCE)
        .build();

    retry.execute(strategy, context -> {
      cluster.refreshMetadata();
      BrokerPort broker = cluster.findControllerBroker();
      broker.deleteTopics(topics, timeoutMs);

      for (String topic : topics) {
        cluster.removeTargetTopic(topic);
      }
      cluster.refreshMetadata();
      return null;
    });
  }

  public void createPartitions(CreatePartitionsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid topic partitions array null", Map.of());
    }
    List<PartitionsSpec> topicPartitions = validator.createPartitions(request.topicPartitions());
    boolean validateOnly = Boolean.TRUE.equals(request.validateOnly());
    int timeoutMs = timeoutMs(request.timeout());

    RetryStrategy<Void> strategy = RetryStrategy.<Void>builder("Could not create partitions")
        .retryOn(ErrorType.NOT_CONTROLLER)
        .build();

    retry.execute(strategy, context -> {
      cluster.refreshMetadata();
      BrokerPort broker = cluster.findControllerBroker();
      broker.createPartitions(topicPartitions, validateOnly, timeoutMs);
      return null;
    });
  }

  private boolean leadersElected(BrokerPort broker, List<String> topics) {
    List<TopicMetadata> metadata;
    try {
      metadata = broker.metadata(topics);
    } catch (ProtocolException ex) {
      // a freshly created topic may not have reached the answering node yet
      if (ex.type() != ErrorType.LEADER_NOT_AVAILABLE && ex.type() != ErrorType.UNKNOWN_TOPIC_OR_PARTITION) {
        throw ex;
      }
      return false;
    }

    Map<String, TopicMetadata> byTopic = metadata.stream()
        .collect(Collectors.toMap(TopicMetadata::topic, Function.identity(), (first, second) -> second));
    for (String topic : topics) {
      TopicMetadata topicMetadata = byTopic.get(topic);
      if (topicMetadata == null || topicMetadata.partitionMetadata().isEmpty()) {
        return false;
      }
      for (PartitionMetadata partition : topicMetadata.partitionMetadata()) {
        if (partition.leader() < 0 || partition.partitionErrorCode() == ErrorType.LEADER_NOT_AVAILABLE.code()) {
          return false;
        }
      }
    }
    return true;
  }

  private int timeoutMs(Integer timeout) {
    return timeout != null ? timeout : Math.toIntExact(timeouts.request().toMillis());
  }
}
