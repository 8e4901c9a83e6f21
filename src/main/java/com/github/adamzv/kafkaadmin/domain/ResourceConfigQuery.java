package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ResourceConfigQuery(
    String type,
    String name,
    List<String> configNames
) {}
