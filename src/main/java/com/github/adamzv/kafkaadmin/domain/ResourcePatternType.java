package com.github.adamzv.kafkaadmin.domain;

/** How an ACL resource name filter matches resource names. */
public enum ResourcePatternType implements ProtocolEnum {
  UNKNOWN(0),
  ANY(1),
  MATCH(2),
  LITERAL(3),
  PREFIXED(4);

  private final int code;

  ResourcePatternType(int code) {
    this.code = code;
  }

  @Override
  public int code() {
    return code;
  }
}
