package com.github.adamzv.kafkaadmin.domain;

public record AclRule(
    AclResourceType resourceType,
    String resourceName,
    ResourcePatternType resourcePatternType,
    String principal,
    String host,
    AclOperationType operation,
    PermissionType permissionType
) {}
