package com.github.adamzv.kafkaadmin.domain;

import java.util.List;
import java.util.Map;

public class DeleteGroupsException extends ProblemException {

  private final List<GroupDeletionResult> groups;

  public DeleteGroupsException(String message, List<GroupDeletionResult> groups) {
    super(new Problem(
        ProblemCodes.DELETE_GROUPS_FAILED,
        message,
        Map.of("groups", List.copyOf(groups))
    ));
    this.groups = List.copyOf(groups);
  }

  public List<GroupDeletionResult> groups() {
    return groups;
  }
}
