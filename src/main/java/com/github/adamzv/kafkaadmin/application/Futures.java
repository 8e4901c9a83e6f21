package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Futures {

  private Futures() {
  }

  /**
   * Waits for {@code future} and rethrows its failure as the original {@link ProblemException}
   * when there is one.
   */
  static <T> T join(CompletableFuture<T> future, String operation) {
    try {
      return future.join();
    } catch (CompletionException | CancellationException ex) {
      throw unwrap(ex, operation);
    }
  }

  static ProblemException unwrap(Throwable ex, String operation) {
    Throwable cause = ex;
    while ((cause instanceof CompletionException || cause instanceof ExecutionException)
        && cause.getCause() != null) {
      cause = cause.getCause();
    }
    if (cause instanceof ProblemException problem) {
      return problem;
    }
    return Problems.operationFailed(
        operation + " failed",
        Map.of("operation", operation, "reason", String.valueOf(cause.getMessage())),
        cause
    );
  }
}
