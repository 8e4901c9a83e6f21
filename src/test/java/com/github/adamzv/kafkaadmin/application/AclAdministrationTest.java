package com.github.adamzv.kafkaadmin.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkaadmin.domain.AclEntry;
import com.github.adamzv.kafkaadmin.domain.AclFilter;
import com.github.adamzv.kafkaadmin.domain.AclFilterResult;
import com.github.adamzv.kafkaadmin.domain.AclGrant;
import com.github.adamzv.kafkaadmin.domain.AclOperationType;
import com.github.adamzv.kafkaadmin.domain.AclResource;
import com.github.adamzv.kafkaadmin.domain.AclResourceType;
import com.github.adamzv.kafkaadmin.domain.AclRule;
import com.github.adamzv.kafkaadmin.domain.AclRuleFilter;
import com.github.adamzv.kafkaadmin.domain.CreateAclsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteAclsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteAclsResponse;
import com.github.adamzv.kafkaadmin.domain.DescribeAclsResponse;
import com.github.adamzv.kafkaadmin.domain.ErrorType;
import com.github.adamzv.kafkaadmin.domain.PermissionType;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.ProtocolException;
import com.github.adamzv.kafkaadmin.domain.ResourcePatternType;
import com.github.adamzv.kafkaadmin.domain.RetryPolicy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class AclAdministrationTest {

  private final StubCluster cluster = new StubCluster();
  private final AclAdministration acls = new AclAdministration(
      cluster,
      new RetryOrchestrator(new RetryPolicy(2, Duration.ofMillis(1), 2, 0.0, Duration.ofSeconds(30)), new ManualTime()),
      new EnumValidator()
  );

  @Test
  void createAclsRetriesWhileControllerMoves() {
    AtomicInteger calls = new AtomicInteger();
    List<AclRule> created = new ArrayList<>();
    cluster.withController(new StubBroker(1) {
      @Override
      public void createAcls(List<AclRule> acl) {
        if (calls.incrementAndGet() == 1) {
          throw Problems.protocol(ErrorType.NOT_CONTROLLER, "This is not the correct controller", Map.of());
        }
        created.addAll(acl);
      }
    });

    boolean result = acls.createAcls(new CreateAclsRequest(List.of(
        new AclEntry("TOPIC", "orders", "LITERAL", "User:alice", "*", "WRITE", "ALLOW"))));

    assertTrue(result);
    assertEquals(2, calls.get());
    assertEquals(AclOperationType.WRITE, created.get(0).operation());
  }

  @Test
  void invalidBatchIsRejectedBeforeAnyRequest() {
    cluster.withController(new StubBroker(1));

    ProblemException ex = assertThrows(ProblemException.class, () -> acls.createAcls(new CreateAclsRequest(List.of(
        new AclEntry("TOPIC", "orders", "LITERAL", "User:alice", "*", "WRITE", "ALLOW"),
        new AclEntry("TOPIC", "orders", "LITERAL", "User:bob", "*", "WRITE", "MAYBE")))));

    assertTrue(ex.getMessage().startsWith("Invalid permission type MAYBE: "));
    assertEquals(0, cluster.refreshes.get());
  }

  @Test
  void describeAclsReturnsControllerAnswer() {
    List<AclRuleFilter> filters = new ArrayList<>();
    cluster.withController(new StubBroker(1) {
      @Override
      public DescribeAclsResponse describeAcls(AclRuleFilter filter) {
        filters.add(filter);
        return new DescribeAclsResponse(List.of(new AclResource(
            AclResourceType.TOPIC, "orders", ResourcePatternType.LITERAL,
            List.of(new AclGrant("User:alice", "*", AclOperationType.READ, PermissionType.ALLOW)))));
      }
    });

    DescribeAclsResponse response = acls.describeAcls(new AclFilter("TOPIC", null, "ANY", null, null, "ANY", "ANY"));

    assertEquals("orders", response.resources().get(0).resourceName());
    assertEquals(ResourcePatternType.ANY, filters.get(0).resourcePatternType());
  }

  @Test
  void deleteAclsPropagatesFatalProtocolError() {
    cluster.withController(new StubBroker(1) {
      @Override
      public DeleteAclsResponse deleteAcls(List<AclRuleFilter> filters) {
        throw Problems.protocol(ErrorType.SECURITY_DISABLED, "Security features are disabled.", Map.of());
      }
    });

    ProtocolException ex = assertThrows(ProtocolException.class, () -> acls.deleteAcls(new DeleteAclsRequest(List.of(
        new AclFilter("ANY", null, "ANY", null, null, "ANY", "ANY")))));

    assertEquals(ErrorType.SECURITY_DISABLED, ex.type());
  }

  @Test
  void deleteAclsReturnsOneResultPerFilter() {
    cluster.withController(new StubBroker(1) {
      @Override
      public DeleteAclsResponse deleteAcls(List<AclRuleFilter> filters) {
        return new DeleteAclsResponse(filters.stream()
            .map(filter -> new AclFilterResult(0, null, List.of()))
            .toList());
      }
    });

    DeleteAclsResponse response = acls.deleteAcls(new DeleteAclsRequest(List.of(
        new AclFilter("TOPIC", "orders", "LITERAL", null, null, "ANY", "ANY"),
        new AclFilter("GROUP", null, "ANY", null, null, "ANY", "ANY"))));

    assertEquals(2, response.filterResponses().size());
  }

  @Test
  void nullFilterArrayIsRejected() {
    assertEquals("Invalid ACL Filter array null",
        assertThrows(ProblemException.class, () -> acls.deleteAcls(null)).getMessage());
    assertEquals("Invalid ACL array null",
        assertThrows(ProblemException.class, () -> acls.createAcls(null)).getMessage());
  }
}
