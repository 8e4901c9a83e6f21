package com.github.adamzv.kafkaadmin.domain;

public final class ProblemCodes {
  public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
  public static final String INVALID_STATE = "INVALID_STATE";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String KAFKA_UNAVAILABLE = "KAFKA_UNAVAILABLE";
  public static final String PROTOCOL_ERROR = "PROTOCOL_ERROR";
  public static final String DELETE_GROUPS_FAILED = "DELETE_GROUPS_FAILED";
  public static final String WAIT_TIMEOUT = "WAIT_TIMEOUT";
  public static final String OPERATION_FAILED = "OPERATION_FAILED";

  private ProblemCodes() {
  }
}
