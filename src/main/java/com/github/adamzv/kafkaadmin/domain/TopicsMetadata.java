package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record TopicsMetadata(
    List<TopicMetadata> topics
) {}
