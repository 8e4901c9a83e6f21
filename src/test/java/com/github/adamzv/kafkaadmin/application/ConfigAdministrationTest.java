package com.github.adamzv.kafkaadmin.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkaadmin.domain.AlterConfigsRequest;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsResult;
import com.github.adamzv.kafkaadmin.domain.ConfigEntry;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceDescription;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceRef;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceType;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceUpdate;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsRequest;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.ProblemCodes;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.ResourceConfig;
import com.github.adamzv.kafkaadmin.domain.ResourceConfigQuery;
import com.github.adamzv.kafkaadmin.domain.RetryPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ConfigAdministrationTest {

  private final StubCluster cluster = new StubCluster();
  private final ConfigAdministration configs = new ConfigAdministration(
      cluster,
      new RetryOrchestrator(new RetryPolicy(2, Duration.ofMillis(1), 2, 0.0, Duration.ofSeconds(30)), new ManualTime()),
      new EnumValidator()
  );

  @Test
  void describeConfigsPassesResolvedResourcesToController() {
    List<ConfigResourceRef> seen = new ArrayList<>();
    List<Boolean> synonyms = new ArrayList<>();
    cluster.withController(new StubBroker(1) {
      @Override
      public DescribeConfigsResponse describeConfigs(List<ConfigResourceRef> resources, boolean includeSynonyms) {
        seen.addAll(resources);
        synonyms.add(includeSynonyms);
        return new DescribeConfigsResponse(List.of(
            new ConfigResourceDescription(ConfigResourceType.TOPIC, "orders", 0, null, List.of())));
      }
    });

    DescribeConfigsResponse response = configs.describeConfigs(new DescribeConfigsRequest(
        List.of(new ResourceConfigQuery("topic", "orders", List.of("cleanup.policy"))), true));

    assertEquals(1, response.resources().size());
    assertEquals(new ConfigResourceRef(ConfigResourceType.TOPIC, "orders", List.of("cleanup.policy")), seen.get(0));
    assertEquals(List.of(true), synonyms);
  }

  @Test
  void describeConfigsRejectsUnknownResourceType() {
    ProblemException ex = assertThrows(ProblemException.class, () -> configs.describeConfigs(
        new DescribeConfigsRequest(List.of(new ResourceConfigQuery("GROUP", "g", null)), false)));

    assertEquals(ProblemCodes.INVALID_ARGUMENT, ex.code());
    assertTrue(ex.getMessage().startsWith("Invalid resource type GROUP: "));
  }

  @Test
  void nullRequestIsRejected() {
    ProblemException ex = assertThrows(ProblemException.class, () -> configs.alterConfigs(null));

    assertEquals("Invalid resources array null", ex.getMessage());
  }

  @Test
  void alterConfigsRetriesWhileControllerMoves() {
    AtomicInteger calls = new AtomicInteger();
    cluster.withController(new StubBroker(1) {
      @Override
      public AlterConfigsResponse alterConfigs(List<ConfigResourceUpdate> resources, boolean validateOnly) {
        if (calls.incrementAndGet() == 1) {
          throw Problems.protocol(ErrorType.NOT_CONTROLLER, "This is not the correct controller", Map.of());
        }
        return new AlterConfigsResponse(resources.stream()
            .map(resource -> new AlterConfigsResult(resource.type(), resource.name(), 0, null))
            .toList());
      }
    });

    AlterConfigsResponse response = configs.alterConfigs(new AlterConfigsRequest(List.of(
        new ResourceConfig("TOPIC", "orders", List.of(new ConfigEntry("retention.ms", "1000")))), false));

    assertEquals(2, calls.get());
    assertEquals("orders", response.resources().get(0).resourceName());
    assertEquals(2, cluster.refreshes.get());
  }
}
