package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.FetchOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.GroupDescription;
import com.github.adamzv.kafkaadmin.domain.PartitionMetadata;
import com.github.adamzv.kafkaadmin.domain.PartitionOffset;
import com.github.adamzv.kafkaadmin.domain.PartitionWatermarks;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.ResetOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.SeekEntry;
import com.github.adamzv.kafkaadmin.domain.SeekTarget;
import com.github.adamzv.kafkaadmin.domain.SetOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.TopicOffsets;
import com.github.adamzv.kafkaadmin.domain.TopicOffsetsQuery;
import com.github.adamzv.kafkaadmin.ports.BrokerPort;
import com.github.adamzv.kafkaadmin.ports.ClusterPort;
import com.github.adamzv.kafkaadmin.ports.GroupConsumerPort;
import com.github.adamzv.kafkaadmin.ports.GroupConsumerProvider;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and moves consumer group offsets.
 *
 * <p>Offsets are never committed with a raw offset-commit request. Instead a short-lived
 * member joins the group with its topic paused, seeks every requested partition, and commits
 * its positions when it stops. That only works while the group has no other members, so
 * {@link #setOffsets} refuses to touch a group that is not empty or dead.
 */
@Component
public class OffsetCoordinator {

  private static final Logger log = LoggerFactory.getLogger(OffsetCoordinator.class);

  static final String GROUP_RUNNING_MESSAGE =
      "The consumer group must have no running instances, current state: ";

  private final ClusterPort cluster;
  private final RetryOrchestrator retry;
  private final EnumValidator validator;
  private final GroupConsumerProvider consumers;
  private final AdminTimeouts timeouts;

  public OffsetCoordinator(ClusterPort cluster,
                           RetryOrchestrator retry,
                           EnumValidator validator,
                           GroupConsumerProvider consumers,
                           AdminTimeouts timeouts) {
    this.cluster = cluster;
    this.retry = retry;
    this.validator = validator;
    this.consumers = consumers;
    this.timeouts = timeouts;
  }

  /**
   * @return one entry per partition, with {@code offset} equal to the high watermark
   */
  public List<PartitionWatermarks> fetchTopicOffsets(String topic) {
    String validTopic = validator.topic(topic);

    RetryStrategy<List<PartitionWatermarks>> strategy =
        RetryStrategy.<List<PartitionWatermarks>>builder("Could not fetch topic offsets")
            .retryOn(ErrorType.UNKNOWN_TOPIC_OR_PARTITION)
            .beforeRetry(ex -> cluster.refreshMetadata())
            .build();

    return retry.execute(strategy, context -> {
      List<Integer> partitions = topicPartitions(validTopic);
      TopicOffsets high = single(cluster.fetchTopicsOffset(
          List.of(new TopicOffsetsQuery(validTopic, false, partitions))), validTopic);
      TopicOffsets low = single(cluster.fetchTopicsOffset(
          List.of(new TopicOffsetsQuery(validTopic, true, partitions))), validTopic);

      Map<Integer, Long> lowByPartition = new HashMap<>();
      for (PartitionOffset offset : low.partitions()) {
        lowByPartition.put(offset.partition(), offset.offset());
      }

      return high.partitions().stream()
          .map(offset -> new PartitionWatermarks(
              offset.partition(),
              offset.offset(),
              offset.offset(),
              lowByPartition.getOrDefault(offset.partition(), offset.offset())
          ))
          .toList();
    });
  }

  /**
   * Committed offsets of {@code groupId} on every partition of the topic. Not retried.
   */
  public List<PartitionOffset> fetchOffsets(FetchOffsetsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid groupId null", Map.of());
    }
    String groupId = validator.groupId(request.groupId());
    String topic = validator.topic(request.topic());

    List<Integer> partitions = topicPartitions(topic);
    BrokerPort coordinator = cluster.findGroupCoordinator(groupId);

    return coordinator.offsetFetch(groupId, topic, partitions).stream()
        .filter(response -> topic.equals(response.topic()))
        .reduce((first, second) -> second)
        .map(response -> response.partitions().stream()
            .map(offset -> new PartitionOffset(
                offset.partition(),
                offset.offset(),
                offset.metadata() == null || offset.metadata().isEmpty() ? null : offset.metadata()
            ))
            .toList())
        .orElse(List.of());
  }

  /**
   * Moves every partition of the topic to its earliest or latest offset.
   */
  public void resetOffsets(ResetOffsetsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid groupId null", Map.of());
    }
    String groupId = validator.groupId(request.groupId());
    String topic = validator.topic(request.topic());
    boolean earliest = Boolean.TRUE.equals(request.earliest());

    long offset = cluster.defaultOffset(earliest);
    List<SeekEntry> partitions = topicPartitions(topic).stream()
        .map(partition -> new SeekEntry(partition, offset))
        .toList();

    setOffsets(new SetOffsetsRequest(groupId, topic, partitions));
  }

  public void setOffsets(SetOffsetsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid groupId null", Map.of());
    }
    String groupId = validator.groupId(request.groupId());
    String topic = validator.topic(request.topic());
    List<SeekTarget> targets = validator.seekTargets(topic, request.partitions());

    try (GroupConsumerPort consumer = consumers.open(groupId)) {
      consumer.subscribe(topic, true);
      GroupDescription description = consumer.describeGroup();

      if (description.state() == null || !description.state().isTerminal()) {
        String state = description.state() == null ? null : description.state().name();
        throw Problems.invalidState(
            GROUP_RUNNING_MESSAGE + state,
            Map.of("groupId", groupId, "state", String.valueOf(state))
        );
      }

      // queued before the poll loop starts so the first fetch already sees every seek
      consumer.pause(List.of(topic));
      for (SeekTarget target : targets) {
        consumer.seek(target);
      }
      CompletableFuture<Void> running = consumer.run((batchTopic, partition, recordCount) -> { });

      awaitFirstFetch(consumer.firstFetch(), running, groupId);
      consumer.stop();
      log.info("offsets_committed groupId={} topic={} partitions={}", groupId, topic, targets.size());
    }
  }

  private void awaitFirstFetch(CompletableFuture<Void> firstFetch,
                               CompletableFuture<Void> running,
                               String groupId) {
    long timeoutMs = timeouts.offsetCommit().toMillis();
    try {
      CompletableFuture.anyOf(firstFetch, running).get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while committing offsets", Map.of("groupId", groupId), ex);
    } catch (ExecutionException ex) {
      throw Futures.unwrap(ex, "setOffsets");
    } catch (TimeoutException ex) {
      throw Problems.waitTimeout(
          "Timed out while waiting for the consumer to adopt the new offsets",
          Map.of("groupId", groupId, "timeoutMs", timeoutMs)
      );
    }

    if (!firstFetch.isDone()) {
      throw Problems.operationFailed(
          "Consumer stopped before the new offsets were adopted",
          Map.of("groupId", groupId)
      );
    }
  }

  private List<Integer> topicPartitions(String topic) {
    cluster.addTargetTopic(topic);
    cluster.refreshMetadataIfNecessary();
    return cluster.findTopicPartitionMetadata(topic).stream()
        .map(PartitionMetadata::partitionId)
        .toList();
  }

  private static TopicOffsets single(List<TopicOffsets> responses, String topic) {
    return responses.stream()
        .filter(response -> topic.equals(response.topic()))
        .reduce((first, second) -> second)
        .orElseThrow(() -> Problems.protocol(
            ErrorType.UNKNOWN_TOPIC_OR_PARTITION,
            "This server does not host this topic-partition",
            Map.of("topic", topic)
        ));
  }
}
