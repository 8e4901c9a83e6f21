package com.github.adamzv.kafkaadmin.domain;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class Problems {

  private Problems() {
  }

  public static ProblemException invalidArgument(String message, Map<String, Object> details) {
    return raise(ProblemCodes.INVALID_ARGUMENT, message, details);
  }

  public static ProblemException invalidState(String message, Map<String, Object> details) {
    return raise(ProblemCodes.INVALID_STATE, message, details);
  }

  public static ProblemException notFound(String message, Map<String, Object> details) {
    return raise(ProblemCodes.NOT_FOUND, message, details);
  }

  public static ProblemException kafkaUnavailable(String message, Map<String, Object> details) {
    return raise(ProblemCodes.KAFKA_UNAVAILABLE, message, details);
  }

  public static ProblemException waitTimeout(String message, Map<String, Object> details) {
    return raise(ProblemCodes.WAIT_TIMEOUT, message, details);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details, Throwable cause) {
    return new ProblemException(new Problem(ProblemCodes.OPERATION_FAILED, message, copyOf(details)), cause);
  }

  public static ProtocolException protocol(ErrorType type, String message, Map<String, Object> details) {
    return new ProtocolException(type, message, details);
  }

  public static ProtocolException protocol(int errorCode, String message, Map<String, Object> details) {
    return new ProtocolException(ErrorType.fromCode(errorCode), errorCode, message, details);
  }

  public static DeleteGroupsException deleteGroups(String message, List<GroupDeletionResult> failures) {
    return new DeleteGroupsException(message, failures);
  }

  private static ProblemException raise(String code, String message, Map<String, Object> details) {
    return new ProblemException(new Problem(code, message, copyOf(details)));
  }

  // Map.copyOf rejects null values, and echoed records often carry them
  static Map<String, Object> copyOf(Map<String, Object> details) {
    if (details == null || details.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new HashMap<>(details));
  }
}
