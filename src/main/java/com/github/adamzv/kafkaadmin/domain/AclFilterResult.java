package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record AclFilterResult(
    int errorCode,
    String errorMessage,
    List<AclRule> matchingAcls
) {}
