package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record DeleteTopicsRequest(
    List<String> topics,
    Integer timeout
) {}
