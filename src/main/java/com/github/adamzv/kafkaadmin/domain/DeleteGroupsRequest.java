package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record DeleteGroupsRequest(
    List<String> groupIds
) {}
