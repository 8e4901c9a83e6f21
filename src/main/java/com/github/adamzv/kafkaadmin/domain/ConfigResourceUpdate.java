package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ConfigResourceUpdate(
    ConfigResourceType type,
    String name,
    List<ConfigEntry> configEntries
) {}
