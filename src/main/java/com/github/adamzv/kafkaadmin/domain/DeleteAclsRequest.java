package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record DeleteAclsRequest(
    List<AclFilter> filters
) {}
