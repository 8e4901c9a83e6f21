package com.github.adamzv.kafkaadmin.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.GroupDeletionResult;
import com.github.adamzv.kafkaadmin.domain.PartitionMetadata;
import com.github.adamzv.kafkaadmin.domain.ProblemCodes;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.ProtocolException;
import com.github.adamzv.kafkaadmin.domain.TopicMetadata;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.admin.TopicDescription;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.TopicPartitionInfo;
import org.apache.kafka.common.errors.GroupMaxSizeReachedException;
import org.apache.kafka.common.errors.GroupNotEmptyException;
import org.apache.kafka.common.errors.NotControllerException;
import org.apache.kafka.common.errors.TopicExistsException;
import org.apache.kafka.common.internals.KafkaFutureImpl;
import org.apache.kafka.common.protocol.Errors;
import org.junit.jupiter.api.Test;

class AdminCallsTest {

  private final AdminCalls calls = new AdminCalls("localhost:9092", Duration.ofMillis(500));

  @Test
  void brokerErrorsBecomeTypedProtocolProblems() {
    ProblemException notController = calls.translate("createTopics", new NotControllerException("moved"), Map.of());
    ProblemException exists = calls.translate("createTopics", new TopicExistsException("exists"), Map.of());

    assertEquals(ErrorType.NOT_CONTROLLER, assertInstanceOf(ProtocolException.class, notController).type());
    assertEquals(ErrorType.TOPIC_ALREADY_EXISTS, assertInstanceOf(ProtocolException.class, exists).type());
    assertEquals("localhost:9092", exists.problem().detail("bootstrapServers"));
  }

  @Test
  void wireCodeWithoutErrorTypeIsKept() {
    ProtocolException ex = assertInstanceOf(ProtocolException.class,
        calls.translate("deleteGroups", new GroupMaxSizeReachedException("full"), Map.of()));

    assertEquals(ErrorType.UNKNOWN_SERVER_ERROR, ex.type());
    assertEquals(Errors.GROUP_MAX_SIZE_REACHED.code(), ex.errorCode());

    GroupDeletionResult result = GroupDeletionResult.failure("billing", ex);
    assertEquals(Errors.GROUP_MAX_SIZE_REACHED.code(), result.errorCode());
    assertEquals(ErrorType.UNKNOWN_SERVER_ERROR, result.error());
    assertFalse(result.succeeded());
  }

  @Test
  void clientFailuresAreReportedAsUnavailable() {
    ProblemException ex = calls.translate("metadata", new KafkaException("connection refused"), Map.of("topic", "orders"));

    assertEquals(ProblemCodes.KAFKA_UNAVAILABLE, ex.code());
    assertEquals("orders", ex.problem().detail("topic"));
  }

  @Test
  void unexpectedFailuresKeepTheirCause() {
    IllegalStateException cause = new IllegalStateException("boom");

    ProblemException ex = calls.translate("metadata", cause, Map.of());

    assertEquals(ProblemCodes.OPERATION_FAILED, ex.code());
    assertEquals(cause, ex.getCause());
  }

  @Test
  void awaitUnwrapsFailedFuture() {
    KafkaFutureImpl<Void> future = new KafkaFutureImpl<>();
    future.completeExceptionally(new GroupNotEmptyException("The group is not empty."));

    ProtocolException ex = assertThrows(ProtocolException.class, () -> calls.await(future, "deleteGroups", Map.of()));

    assertEquals(ErrorType.NON_EMPTY_GROUP, ex.type());
    assertEquals(ErrorType.NON_EMPTY_GROUP, AdminCalls.errorType(new GroupNotEmptyException("x")));
    assertEquals(ErrorType.UNKNOWN_SERVER_ERROR, AdminCalls.errorType(new KafkaException("x")));
  }

  @Test
  void awaitTimesOutOnHungFuture() {
    ProblemException ex = assertThrows(ProblemException.class,
        () -> calls.await(new KafkaFutureImpl<Void>(), "metadata", Map.of()));

    assertEquals(ProblemCodes.KAFKA_UNAVAILABLE, ex.code());
    assertEquals("ok", calls.await(KafkaFuture.completedFuture("ok"), "metadata", Map.of()));
  }

  @Test
  void missingLeaderIsReportedAsLeaderNotAvailable() {
    Node broker = new Node(1, "kafka-1", 9092);
    TopicDescription description = new TopicDescription("orders", false, List.of(
        new TopicPartitionInfo(1, null, List.of(broker), List.of()),
        new TopicPartitionInfo(0, broker, List.of(broker), List.of(broker))
    ));

    TopicMetadata metadata = AdminCalls.toTopicMetadata(description);

    PartitionMetadata first = metadata.partitionMetadata().get(0);
    PartitionMetadata second = metadata.partitionMetadata().get(1);
    assertEquals(0, first.partitionId());
    assertEquals(1, first.leader());
    assertEquals(1, second.partitionId());
    assertEquals(AdminCalls.NO_LEADER, second.leader());
    assertEquals(ErrorType.LEADER_NOT_AVAILABLE.code(), second.partitionErrorCode());
    assertEquals(List.of(), second.isr());
  }
}
