package com.github.adamzv.kafkaadmin.domain;

public record AlterConfigsResult(
    ConfigResourceType resourceType,
    String resourceName,
    int errorCode,
    String errorMessage
) {}
