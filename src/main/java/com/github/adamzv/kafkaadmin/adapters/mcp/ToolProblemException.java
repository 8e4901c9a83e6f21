package com.github.adamzv.kafkaadmin.adapters.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.adamzv.kafkaadmin.domain.Problem;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tool failure whose message is the JSON error body returned to the MCP client.
 */
public class ToolProblemException extends RuntimeException {

  private final Problem problem;

  public ToolProblemException(Problem problem, Throwable cause, ObjectMapper objectMapper) {
    super(problem != null ? serialize(problem, objectMapper) : null, cause);
    this.problem = problem;
  }

  public Problem problem() {
    return problem;
  }

  static String serialize(Problem problem, ObjectMapper objectMapper) {
    Map<String, Object> error = new LinkedHashMap<>();
    error.put("code", problem.code());
    error.put("message", problem.message());
    if (problem.details() != null && !problem.details().isEmpty()) {
      error.put("details", problem.details());
    }
    try {
      return objectMapper.writeValueAsString(Map.of("error", error));
    } catch (JsonProcessingException ex) {
      return problem.code() + ": " + problem.message();
    }
  }
}
