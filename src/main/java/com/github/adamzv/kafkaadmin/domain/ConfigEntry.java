package com.github.adamzv.kafkaadmin.domain;

public record ConfigEntry(
    String name,
    String value
) {}
