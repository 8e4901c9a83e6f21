package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record AlterConfigsRequest(
    List<ResourceConfig> resources,
    Boolean validateOnly
) {}
