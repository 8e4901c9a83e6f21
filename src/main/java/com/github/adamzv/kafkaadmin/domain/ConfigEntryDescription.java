package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ConfigEntryDescription(
    String name,
    String value,
    boolean readOnly,
    boolean isDefault,
    boolean isSensitive,
    String source,
    List<ConfigSynonym> synonyms
) {}
