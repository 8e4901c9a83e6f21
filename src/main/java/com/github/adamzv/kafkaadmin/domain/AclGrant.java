package com.github.adamzv.kafkaadmin.domain;

public record AclGrant(
    String principal,
    String host,
    AclOperationType operation,
    PermissionType permissionType
) {}
