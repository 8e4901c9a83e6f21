package com.github.adamzv.kafkaadmin.domain;

import java.util.List;

public record ListGroupsResult(
    List<GroupListing> groups
) {}
