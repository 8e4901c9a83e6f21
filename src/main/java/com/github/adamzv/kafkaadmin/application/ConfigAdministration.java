package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.AlterConfigsRequest;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceRef;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceUpdate;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsRequest;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.ports.ClusterPort;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ConfigAdministration {

  private final ClusterPort cluster;
  private final RetryOrchestrator retry;
  private final EnumValidator validator;

  public ConfigAdministration(ClusterPort cluster, RetryOrchestrator retry, EnumValidator validator) {
    this.cluster = cluster;
    this.retry = retry;
    this.validator = validator;
  }

  public DescribeConfigsResponse describeConfigs(DescribeConfigsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid resources array null", Map.of());
    }
    List<ConfigResourceRef> resources = validator.describeConfigs(request.resources());
    boolean includeSynonyms = Boolean.TRUE.equals(request.includeSynonyms());

    RetryStrategy<DescribeConfigsResponse> strategy =
        RetryStrategy.<DescribeConfigsResponse>builder("Could not describe configs")
            .retryOn(ErrorType.NOT_CONTROLLER)
            .build();

    return retry.execute(strategy, context -> {
      cluster.refreshMetadata();
      return cluster.findControllerBroker().describeConfigs(resources, includeSynonyms);
    });
  }

  public AlterConfigsResponse alterConfigs(AlterConfigsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid resources array null", Map.of());
    }
    List<ConfigResourceUpdate> resources = validator.alterConfigs(request.resources());
    boolean validateOnly = Boolean.TRUE.equals(request.validateOnly());

    RetryStrategy<AlterConfigsResponse> strategy =
        RetryStrategy.<AlterConfigsResponse>builder("Could not alter configs")
            .retryOn(ErrorType.NOT_CONTROLLER)
            .build();

    return retry.execute(strategy, context -> {
      cluster.refreshMetadata();
      return cluster.findControllerBroker().alterConfigs(resources, validateOnly);
    });
  }
}
