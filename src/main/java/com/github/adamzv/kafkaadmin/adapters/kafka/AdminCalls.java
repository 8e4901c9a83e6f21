package com.github.adamzv.kafkaadmin.adapters.kafka;

import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.PartitionMetadata;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.TopicMetadata;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.TopicPartitionInfo;
import org.apache.kafka.common.errors.ApiException;
import org.apache.kafka.common.protocol.Errors;

/**
 * Waits on admin client futures and turns their failures into problems. Broker errors become
 * {@link com.github.adamzv.kafkaadmin.domain.ProtocolException}s typed by their wire code, so
 * callers can decide on retries without knowing the client's exception classes.
 */
final class AdminCalls {

  static final int NO_LEADER = -1;

  private final String bootstrapServers;
  private final Duration timeout;

  AdminCalls(String bootstrapServers, Duration timeout) {
    this.bootstrapServers = bootstrapServers;
    this.timeout = timeout;
  }

  Duration timeout() {
    return timeout;
  }

  int timeoutMs() {
    return Math.toIntExact(timeout.toMillis());
  }

  <T> T await(KafkaFuture<T> future, String operation, Map<String, Object> context) {
    try {
      // the client enforces its own api timeout, this only guards against a hung future
      return future.get(timeout.toMillis() * 2, TimeUnit.MILLISECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw Problems.operationFailed("Interrupted while executing " + operation, context, ex);
    } catch (TimeoutException ex) {
      throw Problems.kafkaUnavailable("Timed out contacting Kafka during " + operation, mergedContext(context, ex));
    } catch (ExecutionException ex) {
      throw translate(operation, ex.getCause(), context);
    }
  }

  ProblemException translate(String operation, Throwable cause, Map<String, Object> context) {
    Map<String, Object> details = mergedContext(context, cause);
    if (cause instanceof ApiException) {
      Errors error = Errors.forException(cause);
      String message = cause.getMessage() != null ? cause.getMessage() : error.message();
      return Problems.protocol(error.code(), message, details);
    }
    if (cause instanceof KafkaException) {
      return Problems.kafkaUnavailable("Kafka operation failed: " + operation, details);
    }
    return Problems.operationFailed("Unexpected failure during " + operation, details, cause);
  }

  /**
   * @return the broker error type of {@code cause}, {@link ErrorType#UNKNOWN_SERVER_ERROR}
   *     for anything the client did not receive from a broker
   */
  static ErrorType errorType(Throwable cause) {
    if (cause instanceof ApiException) {
      return ErrorType.fromCode(Errors.forException(cause).code());
    }
    return ErrorType.UNKNOWN_SERVER_ERROR;
  }

  static TopicMetadata toTopicMetadata(TopicDescription description) {
    List<PartitionMetadata> partitions = description.partitions().stream()
        .sorted(Comparator.comparingInt(TopicPartitionInfo::partition))
        .map(partition -> new PartitionMetadata(
            partition.leader() == null ? ErrorType.LEADER_NOT_AVAILABLE.code() : ErrorType.NONE.code(),
            partition.partition(),
            partition.leader() == null ? NO_LEADER : partition.leader().id(),
            nodeIds(partition.replicas()),
            nodeIds(partition.isr())
        ))
        .toList();
    return new TopicMetadata(description.name(), partitions);
  }

  private static List<Integer> nodeIds(List<Node> nodes) {
    if (nodes == null || nodes.isEmpty()) {
      return List.of();
    }
    return nodes.stream().map(Node::id).toList();
  }

  private Map<String, Object> mergedContext(Map<String, Object> context, Throwable cause) {
    Map<String, Object> merged = new HashMap<>(context);
    merged.put("bootstrapServers", bootstrapServers);
    merged.put("error", cause == null ? "unknown" : cause.getClass().getSimpleName());
    merged.put("message", cause == null ? null : cause.getMessage());
    return merged;
  }
}
