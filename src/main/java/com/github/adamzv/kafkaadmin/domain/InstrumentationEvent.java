package com.github.adamzv.kafkaadmin.domain;

import java.util.Map;

public record InstrumentationEvent(
    String id,
    String type,
    long timestamp,
    Map<String, Object> payload
) {}
