package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ConfigResourceRef(
    ConfigResourceType type,
    String name,
    List<String> configNames
) {}
