package com.github.adamzv.kafkaadmin.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.github.adamzv.kafkaadmin.domain.GroupListing;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class GroupIndexTest {

  @Test
  void listingIsLoadedOnceForEveryBroker() {
    AtomicInteger loads = new AtomicInteger();
    GroupIndex index = new GroupIndex(() -> {
      loads.incrementAndGet();
      return Map.of(
          1, List.of(new GroupListing("billing", "consumer")),
          2, List.of(new GroupListing("audit", "consumer"), new GroupListing("legacy", ""))
      );
    });

    assertEquals(List.of(new GroupListing("billing", "consumer")), index.coordinatedBy(1));
    assertEquals(2, index.coordinatedBy(2).size());
    assertEquals(List.of(), index.coordinatedBy(3));
    assertEquals(1, loads.get());
  }
}
