package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record AlterConfigsResponse(
    List<AlterConfigsResult> resources
) {}
