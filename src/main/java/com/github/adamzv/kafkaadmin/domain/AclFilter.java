package com.github.adamzv.kafkaadmin.domain;

public record AclFilter(
    String resourceType,
    String resourceName,
    String resourcePatternType,
    String principal,
    String host,
    String operation,
    String permissionType
) {}
