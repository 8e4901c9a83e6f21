package com.github.adamzv.kafkaadmin.domain;

import java.util.HashMap;
import java.util.Map;

/**
 * A typed failure returned by a broker. Retry decisions are made on {@link #type()};
 * {@link #errorCode()} keeps the wire code even when it has no {@link ErrorType}.
 */
public class ProtocolException extends ProblemException {

  private final ErrorType type;
  private final int errorCode;

  public ProtocolException(ErrorType type, String message, Map<String, Object> details) {
    this(type, type.code(), message, details);
  }

  public ProtocolException(ErrorType type, int errorCode, String message, Map<String, Object> details) {
    super(new Problem(ProblemCodes.PROTOCOL_ERROR, message, withType(type, details)));
    this.type = type;
    this.errorCode = errorCode;
  }

  public ErrorType type() {
    return type;
  }

  public int errorCode() {
    return errorCode;
  }

  private static Map<String, Object> withType(ErrorType type, Map<String, Object> details) {
    Map<String, Object> merged = new HashMap<>();
    if (details != null) {
      merged.putAll(details);
    }
    merged.put("type", type.name());
    return Problems.copyOf(merged);
  }
}
