package com.github.adamzv.kafkaadmin.domain;

public record SeekEntry(
    Integer partition,
    Long offset
) {}
