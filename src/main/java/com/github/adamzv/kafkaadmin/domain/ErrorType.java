package com.github.adamzv.kafkaadmin.domain;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Kafka protocol error kinds the admin layer discriminates on, keyed by their wire code.
 * Codes outside this set collapse into {@link #UNKNOWN_SERVER_ERROR}.
 */
public enum ErrorType {
  UNKNOWN_SERVER_ERROR(-1),
  NONE(0),
  UNKNOWN_TOPIC_OR_PARTITION(3),
  LEADER_NOT_AVAILABLE(5),
  NOT_LEADER_OR_FOLLOWER(6),
  REQUEST_TIMED_OUT(7),
  NETWORK_EXCEPTION(13),
  COORDINATOR_LOAD_IN_PROGRESS(14),
  COORDINATOR_NOT_AVAILABLE(15),
  NOT_COORDINATOR(16),
  INVALID_TOPIC_EXCEPTION(17),
  INVALID_GROUP_ID(24),
  TOPIC_AUTHORIZATION_FAILED(29),
  GROUP_AUTHORIZATION_FAILED(30),
  CLUSTER_AUTHORIZATION_FAILED(31),
  TOPIC_ALREADY_EXISTS(36),
  INVALID_PARTITIONS(37),
  INVALID_REPLICATION_FACTOR(38),
  INVALID_REPLICA_ASSIGNMENT(39),
  INVALID_CONFIG(40),
  NOT_CONTROLLER(41),
  INVALID_REQUEST(42),
  SECURITY_DISABLED(54),
  NON_EMPTY_GROUP(68),
  GROUP_ID_NOT_FOUND(69);

  private static final Map<Integer, ErrorType> BY_CODE = Arrays.stream(values())
      .collect(Collectors.toUnmodifiableMap(ErrorType::code, Function.identity()));

  private final int code;

  ErrorType(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static ErrorType fromCode(int code) {
    return BY_CODE.getOrDefault(code, UNKNOWN_SERVER_ERROR);
  }

  public static ErrorType fromName(String name) {
    if (name == null) {
      return UNKNOWN_SERVER_ERROR;
    }
    try {
      return valueOf(name);
    } catch (IllegalArgumentException ex) {
      return UNKNOWN_SERVER_ERROR;
    }
  }
}
