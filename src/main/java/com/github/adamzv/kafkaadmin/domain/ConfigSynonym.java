package com.github.adamzv.kafkaadmin.domain;

public record ConfigSynonym(
    String name,
    String value,
    String source
) {}
