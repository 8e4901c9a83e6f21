package com.github.adamzv.kafkaadmin.domain;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum AdminEvent {
  CONNECT("admin.connect"),
  DISCONNECT("admin.disconnect");

  private final String eventName;

  AdminEvent(String eventName) {
    this.eventName = eventName;
  }

  public String eventName() {
    return eventName;
  }

  public static AdminEvent fromEventName(String eventName) {
    for (AdminEvent event : values()) {
      if (event.eventName.equals(eventName)) {
        return event;
      }
    }
    return null;
  }

  public static String describeKeys() {
    return Arrays.stream(values())
        .map(event -> "admin.events." + event.name())
        .collect(Collectors.joining(", "));
  }
}
