package com.github.adamzv.kafkaadmin.adapters.mcp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkaadmin.application.ClusterAdmin;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.ProblemCodes;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.TopicsMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AdminToolsTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

  @Test
  void successfulCallIsTimed() {
    AdminTools tools = new AdminTools(new FixedAdmin(), objectMapper, meterRegistry);

    List<String> topics = tools.listTopics();

    assertEquals(List.of("orders", "payments"), topics);
    assertEquals(1L, meterRegistry.get("kafka_admin_tool_duration_seconds").tag("tool", "listTopics").timer().count());
  }

  @Test
  void problemIsReturnedAsJsonErrorBody() throws Exception {
    AdminTools tools = new AdminTools(new FixedAdmin(), objectMapper, meterRegistry);

    ToolProblemException ex = assertThrows(ToolProblemException.class,
        () -> tools.fetchTopicMetadata(new AdminTools.TopicsInput(List.of("missing"))));

    JsonNode error = objectMapper.readTree(ex.getMessage()).get("error");
    assertEquals(ProblemCodes.PROTOCOL_ERROR, error.get("code").asText());
    assertEquals("This server does not host this topic-partition", error.get("message").asText());
    assertEquals("UNKNOWN_TOPIC_OR_PARTITION", error.get("details").get("type").asText());
    assertSame(ex.problem(), ((ProblemException) ex.getCause()).problem());
    assertEquals(1.0, meterRegistry.get("kafka_admin_tool_errors_total")
        .tag("tool", "fetchTopicMetadata")
        .tag("code", ProblemCodes.PROTOCOL_ERROR)
        .counter()
        .count());
  }

  @Test
  void problemWithoutDetailsOmitsDetailsField() throws Exception {
    String body = ToolProblemException.serialize(
        Problems.invalidArgument("Invalid topic null", Map.of()).problem(), objectMapper);

    JsonNode error = objectMapper.readTree(body).get("error");
    assertEquals(ProblemCodes.INVALID_ARGUMENT, error.get("code").asText());
    assertFalse(error.has("details"));
  }

  private static final class FixedAdmin extends ClusterAdmin {

    FixedAdmin() {
      super(null, null, null, null, null, null, null, null);
    }

    @Override
    public List<String> listTopics() {
      return List.of("orders", "payments");
    }

    @Override
    public TopicsMetadata fetchTopicMetadata(List<String> topicNames) {
      throw Problems.protocol(
          ErrorType.UNKNOWN_TOPIC_OR_PARTITION,
          "This server does not host this topic-partition",
          Map.of("topics", topicNames)
      );
    }
  }
}
