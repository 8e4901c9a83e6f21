package com.github.adamzv.kafkaadmin.adapters.kafka;

import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import com.github.adamzv.kafkaadmin.domain.GroupDescription;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.SeekTarget;
import com.github.adamzv.kafkaadmin.ports.GroupConsumerPort;
import com.github.adamzv.kafkaadmin.support.KafkaProperties;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Group member that only exists to move committed offsets.
 *
 * <p>{@link KafkaConsumer} is not thread safe, so after {@link #run} every consumer call
 * happens on the poll thread. Seeks and pauses requested from other threads are queued and
 * applied there, on assignment or before the next poll, whichever comes first.
 */
class KafkaGroupConsumer implements GroupConsumerPort {

  private static final Logger log = LoggerFactory.getLogger(KafkaGroupConsumer.class);
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(100);

  private final String groupId;
  private final KafkaProperties kafkaProperties;
  private final KafkaClusterAdapter cluster;
  private final AdminTimeouts timeouts;

  private final Map<TopicPartition, Long> pendingSeeks = new ConcurrentHashMap<>();
  private final Set<TopicPartition> seeked = ConcurrentHashMap.newKeySet();
  private final Set<String> pausedTopics = ConcurrentHashMap.newKeySet();
  private final CompletableFuture<Void> firstFetch = new CompletableFuture<>();
  private final CompletableFuture<Void> running = new CompletableFuture<>();

  private Consumer<byte[], byte[]> consumer;
  private String topic;
  private Thread pollThread;
  private volatile boolean stopRequested;
  private volatile boolean commitOnStop;

  KafkaGroupConsumer(String groupId,
                     KafkaProperties kafkaProperties,
                     KafkaClusterAdapter cluster,
                     AdminTimeouts timeouts) {
    this.groupId = groupId;
    this.kafkaProperties = kafkaProperties;
    this.cluster = cluster;
    this.timeouts = timeouts;
  }

  @Override
  public void subscribe(String topic, boolean fromBeginning) {
    if (consumer != null) {
      throw Problems.invalidState("Consumer is already subscribed", Map.of("groupId", groupId, "topic", this.topic));
    }
    Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafkaProperties.bootstrapServers());
    props.put(ConsumerConfig.CLIENT_ID_CONFIG, kafkaProperties.clientId() + "-offsets-" + groupId);
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, fromBeginning ? "earliest" : "latest");
    props.put(ConsumerConfig.REQUEST_TIMEOUT_MS_CONFIG, Math.toIntExact(timeouts.request().toMillis()));
    try {
      this.consumer = new KafkaConsumer<>(props);
    } catch (KafkaException ex) {
      throw Problems.kafkaUnavailable(
          "Could not create group consumer",
          Map.of("groupId", groupId, "message", String.valueOf(ex.getMessage()))
      );
    }
    this.topic = topic;
  }

  @Override
  public GroupDescription describeGroup() {
    return cluster.describeGroup(groupId);
  }

  @Override
  public void pause(List<String> topics) {
    pausedTopics.addAll(topics);
  }

  @Override
  public void seek(SeekTarget target) {
    TopicPartition partition = new TopicPartition(target.topic(), target.partition());
    pendingSeeks.put(partition, target.offset());
  }

  @Override
  public synchronized CompletableFuture<Void> run(BatchHandler handler) {
    if (consumer == null) {
      throw Problems.invalidState("Consumer must subscribe before running", Map.of("groupId", groupId));
    }
    if (pollThread != null) {
      return running;
    }
    pollThread = new Thread(() -> pollLoop(handler), "group-offsets-" + groupId);
    pollThread.setDaemon(true);
    pollThread.start();
    return running;
  }

  @Override
  public CompletableFuture<Void> firstFetch() {
    return firstFetch;
  }

  @Override
  public void stop() {
    commitOnStop = true;
    if (!awaitPollThread()) {
      return;
    }
    try {
      running.get(timeouts.offsetCommit().toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while stopping group consumer", Map.of("groupId", groupId), ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof ProblemException problem) {
        throw problem;
      }
      throw cluster.calls().translate("commitOffsets", cause, Map.of("groupId", groupId));
    } catch (TimeoutException ex) {
      throw Problems.waitTimeout(
          "Timed out while committing offsets",
          Map.of("groupId", groupId, "timeoutMs", timeouts.offsetCommit().toMillis())
      );
    }
  }

  @Override
  public synchronized void close() {
    if (pollThread == null) {
      if (consumer != null) {
        consumer.close(timeouts.request());
        consumer = null;
      }
      return;
    }
    if (!running.isDone()) {
      awaitPollThread();
    }
  }

  private synchronized boolean awaitPollThread() {
    if (pollThread == null) {
      return false;
    }
    stopRequested = true;
    consumer.wakeup();
    try {
      pollThread.join(timeouts.offsetCommit().toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    return true;
  }

  private void pollLoop(BatchHandler handler) {
    try {
      consumer.subscribe(List.of(topic), new ConsumerRebalanceListener() {
        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
          applyPending(partitions);
        }
      });

      while (!stopRequested) {
        boolean adopted = isAdopted(consumer.assignment());
        ConsumerRecords<byte[], byte[]> records;
        try {
          records = consumer.poll(POLL_TIMEOUT);
        } catch (WakeupException ex) {
          break;
        }
        for (TopicPartition partition : records.partitions()) {
          handler.handle(partition.topic(), partition.partition(), records.records(partition).size());
        }
        applyPending(consumer.assignment());
        if (adopted) {
          firstFetch.complete(null);
        }
      }

      if (commitOnStop) {
        commitSeekedPositions();
      }
      running.complete(null);
    } catch (RuntimeException ex) {
      log.warn("group_consumer_failed groupId={} error={}", groupId, ex.getMessage());
      firstFetch.completeExceptionally(ex);
      running.completeExceptionally(ex);
    } finally {
      try {
        consumer.close(timeouts.request());
      } catch (KafkaException ex) {
        log.warn("group_consumer_close_failed groupId={} error={}", groupId, ex.getMessage());
      }
    }
  }

  private void applyPending(Collection<TopicPartition> assigned) {
    for (TopicPartition partition : assigned) {
      Long offset = pendingSeeks.remove(partition);
      if (offset != null) {
        if (offset == SeekTarget.EARLIEST) {
          consumer.seekToBeginning(List.of(partition));
        } else if (offset == SeekTarget.LATEST) {
          consumer.seekToEnd(List.of(partition));
        } else {
          consumer.seek(partition, offset);
        }
        seeked.add(partition);
      }
    }
    List<TopicPartition> toPause = assigned.stream()
        .filter(partition -> pausedTopics.contains(partition.topic()))
        .toList();
    if (!toPause.isEmpty()) {
      consumer.pause(toPause);
    }
  }

  // seeks were applied and at least one poll ran since
  private boolean isAdopted(Set<TopicPartition> assignment) {
    return !assignment.isEmpty()
        && !seeked.isEmpty()
        && pendingSeeks.keySet().stream().noneMatch(assignment::contains);
  }

  private void commitSeekedPositions() {
    try {
      commitPositions();
    } catch (WakeupException ex) {
      // a wakeup raised by stop() outside of poll surfaces on the next blocking call
      commitPositions();
    }
  }

  private void commitPositions() {
    Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
    for (TopicPartition partition : seeked) {
      if (consumer.assignment().contains(partition)) {
        offsets.put(partition, new OffsetAndMetadata(consumer.position(partition)));
      }
    }
    if (!offsets.isEmpty()) {
      consumer.commitSync(offsets);
    }
    log.debug("group_offsets_committed groupId={} partitions={}", groupId, offsets.size());
  }
}
