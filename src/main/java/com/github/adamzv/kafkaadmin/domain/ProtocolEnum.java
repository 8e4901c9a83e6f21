package com.github.adamzv.kafkaadmin.domain;

import java.util.Locale;

/**
 * Enumerations whose members have a fixed numeric wire code.
 */
public interface ProtocolEnum {

  int code();

  /**
   * Resolves a raw value, either the member name (any case) or its numeric code.
   *
   * @return the matching member, or {@code null} when the value is not a member
   */
  static <E extends Enum<E> & ProtocolEnum> E resolve(Class<E> type, String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    String value = raw.trim();
    for (E member : type.getEnumConstants()) {
      if (member.name().equals(value.toUpperCase(Locale.ROOT))) {
        return member;
      }
    }
    try {
      return fromCode(type, Integer.parseInt(value));
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  /**
   * @return the member with the given wire code, or {@code null}
   */
  static <E extends Enum<E> & ProtocolEnum> E fromCode(Class<E> type, int code) {
    for (E member : type.getEnumConstants()) {
      if (member.code() == code) {
        return member;
      }
    }
    return null;
  }
}
