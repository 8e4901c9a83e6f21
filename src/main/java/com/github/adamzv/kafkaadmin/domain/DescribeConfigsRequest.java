package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record DescribeConfigsRequest(
    List<ResourceConfigQuery> resources,
    Boolean includeSynonyms
) {}
