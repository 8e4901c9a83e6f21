package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.GroupDeletionResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Group ids still to delete, plus the deletions that already succeeded. A group that was
 * deleted once is never sent again, so each pass only targets the previous pass's failures.
 */
final class GroupDeletionProgress {

  private final List<String> requested;
  private final List<String> remaining;
  private final Map<String, GroupDeletionResult> succeeded = new HashMap<>();

  GroupDeletionProgress(List<String> groupIds) {
    this.requested = List.copyOf(groupIds);
    this.remaining = new ArrayList<>(groupIds);
  }

  synchronized List<String> remaining() {
    return List.copyOf(remaining);
  }

  synchronized boolean isDone() {
    return remaining.isEmpty();
  }

  synchronized void recordSuccesses(List<GroupDeletionResult> results) {
    for (GroupDeletionResult result : results) {
      if (result.succeeded()) {
        succeeded.putIfAbsent(result.groupId(), result);
        remaining.remove(result.groupId());
      }
    }
  }

  /**
   * Successful deletions in request order.
   */
  synchronized List<GroupDeletionResult> results() {
    return requested.stream()
        .map(succeeded::get)
        .filter(Objects::nonNull)
        .toList();
  }
}
