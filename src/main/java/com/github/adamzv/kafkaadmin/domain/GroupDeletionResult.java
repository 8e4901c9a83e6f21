package com.github.adamzv.kafkaadmin.domain;

public record GroupDeletionResult(
    String groupId,
    int errorCode,
    ErrorType error
) {

  public static GroupDeletionResult success(String groupId) {
    return new GroupDeletionResult(groupId, ErrorType.NONE.code(), ErrorType.NONE);
  }

  public static GroupDeletionResult failure(String groupId, ErrorType error) {
    return new GroupDeletionResult(groupId, error.code(), error);
  }

  public static GroupDeletionResult failure(String groupId, ProtocolException cause) {
    return new GroupDeletionResult(groupId, cause.errorCode(), cause.type());
  }

  public boolean succeeded() {
    return errorCode == 0;
  }
}
