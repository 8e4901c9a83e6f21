package com.github.adamzv.kafkaadmin.domain;

public enum ConfigResourceType implements ProtocolEnum {
  TOPIC(2),
  BROKER(4),
  BROKER_LOGGER(8);

  private final int code;

  ConfigResourceType(int code) {
    this.code = code;
  }

  @Override
  public int code() {
    return code;
  }
}
