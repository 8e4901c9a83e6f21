package com.github.adamzv.kafkaadmin.adapters.kafka;

import com.github.adamzv.kafkaadmin.domain.GroupListing;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Consumer groups keyed by coordinator node id. Loaded at most once, so one listGroups
 * fan-out lists and describes the cluster's groups a single time no matter how many
 * brokers it asks. A metadata refresh replaces the index.
 */
class GroupIndex {

  private final Supplier<Map<Integer, List<GroupListing>>> loader;
  private Map<Integer, List<GroupListing>> byCoordinator;

  GroupIndex(Supplier<Map<Integer, List<GroupListing>>> loader) {
    this.loader = loader;
  }

  synchronized List<GroupListing> coordinatedBy(int nodeId) {
    if (byCoordinator == null) {
      byCoordinator = Map.copyOf(loader.get());
    }
    return byCoordinator.getOrDefault(nodeId, List.of());
  }
}
