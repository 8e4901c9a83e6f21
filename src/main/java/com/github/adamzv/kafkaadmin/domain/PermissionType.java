package com.github.adamzv.kafkaadmin.domain;

public enum PermissionType implements ProtocolEnum {
  UNKNOWN(0),
  ANY(1),
  DENY(2),
  ALLOW(3);

  private final int code;

  PermissionType(int code) {
    this.code = code;
  }

  @Override
  public int code() {
    return code;
  }
}
