package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.AclFilter;
import com.github.adamzv.kafkaadmin.domain.AclRule;
import com.github.adamzv.kafkaadmin.domain.AclRuleFilter;
import com.github.adamzv.kafkaadmin.domain.CreateAclsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteAclsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteAclsResponse;
import com.github.adamzv.kafkaadmin.domain.DescribeAclsResponse;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.ports.ClusterPort;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * ACL management. A batch is validated as a whole before the controller sees any of it.
 */
@Component
public class AclAdministration {

  private final ClusterPort cluster;
  private final RetryOrchestrator retry;
  private final EnumValidator validator;

  public AclAdministration(ClusterPort cluster, RetryOrchestrator retry, EnumValidator validator) {
    this.cluster = cluster;
    this.retry = retry;
    this.validator = validator;
  }

  public boolean createAcls(CreateAclsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid ACL array null", Map.of());
    }
    List<AclRule> acl = validator.createAcls(request.acl());

    RetryStrategy<Boolean> strategy = RetryStrategy.<Boolean>builder("Could not create ACL")
        .retryOn(ErrorType.NOT_CONTROLLER)
        .build();

    return retry.execute(strategy, context -> {
      cluster.refreshMetadata();
      cluster.findControllerBroker().createAcls(acl);
      return true;
    });
  }

  public DescribeAclsResponse describeAcls(AclFilter filter) {
    AclRuleFilter validated = validator.describeAcls(filter);

    RetryStrategy<DescribeAclsResponse> strategy =
        RetryStrategy.<DescribeAclsResponse>builder("Could not describe ACL")
            .retryOn(ErrorType.NOT_CONTROLLER)
            .build();

    return retry.execute(strategy, context -> {
      cluster.refreshMetadata();
      return cluster.findControllerBroker().describeAcls(validated);
    });
  }

  public DeleteAclsResponse deleteAcls(DeleteAclsRequest request) {
    if (request == null) {
      throw Problems.invalidArgument("Invalid ACL Filter array null", Map.of());
    }
    List<AclRuleFilter> filters = validator.deleteAcls(request.filters());

    RetryStrategy<DeleteAclsResponse> strategy =
        RetryStrategy.<DeleteAclsResponse>builder("Could not delete ACL")
            .retryOn(ErrorType.NOT_CONTROLLER)
            .build();

    return retry.execute(strategy, context -> {
      cluster.refreshMetadata();
      return cluster.findControllerBroker().deleteAcls(filters);
    });
  }
}
