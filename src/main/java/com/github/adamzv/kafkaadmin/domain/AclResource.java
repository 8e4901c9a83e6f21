package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record AclResource(
    AclResourceType resourceType,
    String resourceName,
    ResourcePatternType resourcePatternType,
    List<AclGrant> acls
) {}
