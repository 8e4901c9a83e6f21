package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.DeleteGroupsException;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.GroupDeletionResult;
import com.github.adamzv.kafkaadmin.domain.GroupListing;
import com.github.adamzv.kafkaadmin.domain.ListGroupsResult;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.ports.BrokerPort;
import com.github.adamzv.kafkaadmin.ports.ClusterPort;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import org.springframework.stereotype.Component;

/**
 * Consumer group operations that span several brokers. Both operations query their brokers
 * concurrently and combine the answers in a fixed order.
 */
@Component
public class GroupAdministration {

  static final String DELETE_GROUPS_ERROR = "Error in DeleteGroups";

  private static final Set<ErrorType> TRANSIENT_COORDINATOR_ERRORS = EnumSet.of(
      ErrorType.COORDINATOR_NOT_AVAILABLE,
      ErrorType.NOT_COORDINATOR,
      ErrorType.COORDINATOR_LOAD_IN_PROGRESS
  );

  private final ClusterPort cluster;
  private final RetryOrchestrator retry;
  private final EnumValidator validator;
  private final ExecutorService fanOutExecutor;

  public GroupAdministration(ClusterPort cluster,
                             RetryOrchestrator retry,
                             EnumValidator validator,
                             ExecutorService fanOutExecutor) {
    this.cluster = cluster;
    this.retry = retry;
    this.validator = validator;
    this.fanOutExecutor = fanOutExecutor;
  }

  /**
   * Lists the groups of every broker in the pool. One failing broker fails the whole call.
   */
  public ListGroupsResult listGroups() {
    cluster.refreshMetadata();

    List<CompletableFuture<ListGroupsResult>> calls = new ArrayList<>();
    for (int nodeId : cluster.brokerNodeIds()) {
      calls.add(CompletableFuture.supplyAsync(() -> cluster.findBroker(nodeId).listGroups(), fanOutExecutor));
    }

    List<GroupListing> groups = new ArrayList<>();
    for (CompletableFuture<ListGroupsResult> call : calls) {
      groups.addAll(Futures.join(call, "listGroups").groups());
    }
    return new ListGroupsResult(List.copyOf(groups));
  }

  /**
   * Deletes the given groups, retrying only the ones that failed on the previous pass.
   *
   * @return one successful result per distinct group id, in request order
   * @throws DeleteGroupsException when some groups still fail once retries are exhausted
   */
  public List<GroupDeletionResult> deleteGroups(List<String> groupIds) {
    GroupDeletionProgress progress = new GroupDeletionProgress(validator.groupIds(groupIds));

    RetryStrategy<List<GroupDeletionResult>> strategy =
        RetryStrategy.<List<GroupDeletionResult>>builder("Could not delete groups")
            .retryOn(ErrorType.NOT_CONTROLLER, ErrorType.COORDINATOR_NOT_AVAILABLE)
            .retryWhen(GroupAdministration::hasTransientFailure)
            .build();

    return retry.execute(strategy, context -> deletionPass(progress));
  }

  private List<GroupDeletionResult> deletionPass(GroupDeletionProgress progress) {
    if (progress.isDone()) {
      return progress.results();
    }
    cluster.refreshMetadata();

    // coordinators can move between passes
    Map<Integer, BrokerPort> coordinators = new LinkedHashMap<>();
    Map<Integer, List<String>> groupsByNode = new LinkedHashMap<>();
    for (String groupId : progress.remaining()) {
      BrokerPort coordinator = cluster.findGroupCoordinator(groupId);
      coordinators.putIfAbsent(coordinator.nodeId(), coordinator);
      groupsByNode.computeIfAbsent(coordinator.nodeId(), nodeId -> new ArrayList<>()).add(groupId);
    }

    List<CompletableFuture<List<GroupDeletionResult>>> calls = new ArrayList<>();
    for (Map.Entry<Integer, List<String>> entry : groupsByNode.entrySet()) {
      BrokerPort coordinator = coordinators.get(entry.getKey());
      List<String> groups = List.copyOf(entry.getValue());
      calls.add(CompletableFuture.supplyAsync(() -> coordinator.deleteGroups(groups), fanOutExecutor));
    }

    List<GroupDeletionResult> results = new ArrayList<>();
    ProblemException callError = null;
    for (CompletableFuture<List<GroupDeletionResult>> call : calls) {
      try {
        results.addAll(Futures.join(call, "deleteGroups"));
      } catch (ProblemException ex) {
        if (callError == null) {
          callError = ex;
        }
      }
    }

    progress.recordSuccesses(results);
    if (callError != null) {
      throw callError;
    }

    List<GroupDeletionResult> failures = results.stream()
        .filter(result -> !result.succeeded())
        .toList();
    if (!failures.isEmpty()) {
      throw Problems.deleteGroups(DELETE_GROUPS_ERROR, failures);
    }
    return progress.results();
  }

  private static boolean hasTransientFailure(ProblemException ex) {
    if (!(ex instanceof DeleteGroupsException deleteGroups)) {
      return false;
    }
    return deleteGroups.groups().stream()
        .anyMatch(result -> TRANSIENT_COORDINATOR_ERRORS.contains(result.error()));
  }
}
