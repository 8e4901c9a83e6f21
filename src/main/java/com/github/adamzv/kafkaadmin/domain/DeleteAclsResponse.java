package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record DeleteAclsResponse(
    List<AclFilterResult> filterResponses
) {}
