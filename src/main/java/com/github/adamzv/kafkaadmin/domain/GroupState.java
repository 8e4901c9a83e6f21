package com.github.adamzv.kafkaadmin.domain;

import java.util.Locale;

public enum GroupState {
  UNKNOWN,
  PREPARING_REBALANCE,
  COMPLETING_REBALANCE,
  STABLE,
  DEAD,
  EMPTY;

  /**
   * Only groups without running members may have their offsets rewritten.
   */
  public boolean isTerminal() {
    return this == EMPTY || this == DEAD;
  }

  public static GroupState parse(String value) {
    if (value == null || value.isBlank()) {
      return UNKNOWN;
    }
    String normalized = value.trim()
        .replaceAll("([a-z])([A-Z])", "$1_$2")
        .toUpperCase(Locale.ROOT);
    for (GroupState state : values()) {
      if (state.name().equals(normalized)) {
        return state;
      }
    }
    return UNKNOWN;
  }
}
