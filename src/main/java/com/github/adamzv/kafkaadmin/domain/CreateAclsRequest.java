package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record CreateAclsRequest(
    List<AclEntry> acl
) {}
