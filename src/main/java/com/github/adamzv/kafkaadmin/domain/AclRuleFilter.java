package com.github.adamzv.kafkaadmin.domain;

public record AclRuleFilter(
    AclResourceType resourceType,
    String resourceName,
    ResourcePatternType resourcePatternType,
    String principal,
    String host,
    AclOperationType operation,
    PermissionType permissionType
) {}
