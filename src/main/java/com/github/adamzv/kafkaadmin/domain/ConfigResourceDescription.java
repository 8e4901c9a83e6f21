package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ConfigResourceDescription(
    ConfigResourceType resourceType,
    String resourceName,
    int errorCode,
    String errorMessage,
    List<ConfigEntryDescription> configEntries
) {}
