package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record DescribeConfigsResponse(
    List<ConfigResourceDescription> resources
) {}
