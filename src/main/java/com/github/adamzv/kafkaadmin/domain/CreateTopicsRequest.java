package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record CreateTopicsRequest(
    List<TopicSpec> topics,
    Boolean validateOnly,
    Integer timeout,
    Boolean waitForLeaders
) {}
