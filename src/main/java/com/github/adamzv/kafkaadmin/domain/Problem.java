package com.github.adamzv.kafkaadmin.domain;

import java.util.Map;

public record Problem(
    String code,
    String message,
    Map<String, Object> details
) {

  public Object detail(String key) {
    return details == null ? null : details.get(key);
  }
}
