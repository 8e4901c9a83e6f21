package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ResourceConfig(
    String type,
    String name,
    List<ConfigEntry> configEntries
) {}
