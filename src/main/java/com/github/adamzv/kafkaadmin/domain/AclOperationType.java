package com.github.adamzv.kafkaadmin.domain;

public enum AclOperationType implements ProtocolEnum {
  UNKNOWN(0),
  ANY(1),
  ALL(2),
  READ(3),
  WRITE(4),
  CREATE(5),
  DELETE(6),
  ALTER(7),
  DESCRIBE(8),
  CLUSTER_ACTION(9),
  DESCRIBE_CONFIGS(10),
  ALTER_CONFIGS(11),
  IDEMPOTENT_WRITE(12);

  private final int code;

  AclOperationType(int code) {
    this.code = code;
  }

  @Override
  public int code() {
    return code;
  }
}
