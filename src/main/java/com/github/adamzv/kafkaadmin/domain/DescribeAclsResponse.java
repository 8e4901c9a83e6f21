package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record DescribeAclsResponse(
    List<AclResource> resources
) {}
