package com.github.adamzv.kafkaadmin.ports;

import com.github.adamzv.kafkaadmin.domain.GroupDescription;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.SeekTarget;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Minimal consumer used to move a group's committed positions. It joins the group like any
 * other member but is never asked to hand records to the application.
 */
public interface GroupConsumerPort extends AutoCloseable {

  void subscribe(String topic, boolean fromBeginning) throws ProblemException;

  GroupDescription describeGroup() throws ProblemException;

  void pause(List<String> topics);

  void seek(SeekTarget target);

  /**
   * Starts the run loop. The returned future completes when the loop ends and fails if the
   * loop fails.
   */
  CompletableFuture<Void> run(BatchHandler handler);

  /**
   * Completes once, after the first fetch cycle following assignment. Pending seeks have been
   * adopted by then.
   */
  CompletableFuture<Void> firstFetch();

  /**
   * Stops the run loop, committing the current positions, and releases the consumer.
   */
  void stop() throws ProblemException;

  /**
   * Releases the consumer without committing. Safe to call after {@link #stop()}.
   */
  @Override
  void close();

  @FunctionalInterface
  interface BatchHandler {
    void handle(String topic, int partition, int recordCount);
  }
}
