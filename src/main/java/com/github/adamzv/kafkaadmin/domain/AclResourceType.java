package com.github.adamzv.kafkaadmin.domain;

public enum AclResourceType implements ProtocolEnum {
  UNKNOWN(0),
  ANY(1),
  TOPIC(2),
  GROUP(3),
  CLUSTER(4),
  TRANSACTIONAL_ID(5),
  DELEGATION_TOKEN(6);

  private final int code;

  AclResourceType(int code) {
    this.code = code;
  }

  @Override
  public int code() {
    return code;
  }
}
