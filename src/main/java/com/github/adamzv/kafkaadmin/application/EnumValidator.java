package com.github.adamzv.kafkaadmin.application;

import com.github.adamzv.kafkaadmin.domain.AclEntry;
import com.github.adamzv.kafkaadmin.domain.AclFilter;
import com.github.adamzv.kafkaadmin.domain.AclOperationType;
import com.github.adamzv.kafkaadmin.domain.AclResourceType;
import com.github.adamzv.kafkaadmin.domain.AclRule;
import com.github.adamzv.kafkaadmin.domain.AclRuleFilter;
import com.github.adamzv.kafkaadmin.domain.ConfigEntry;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceRef;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceType;
import com.github.adamzv.kafkaadmin.domain.ConfigResourceUpdate;
import com.github.adamzv.kafkaadmin.domain.PartitionsSpec;
import com.github.adamzv.kafkaadmin.domain.PermissionType;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.Problems;
import com.github.adamzv.kafkaadmin.domain.ProtocolEnum;
import com.github.adamzv.kafkaadmin.domain.ResourceConfig;
import com.github.adamzv.kafkaadmin.domain.ResourceConfigQuery;
import com.github.adamzv.kafkaadmin.domain.ResourcePatternType;
import com.github.adamzv.kafkaadmin.domain.SeekEntry;
import com.github.adamzv.kafkaadmin.domain.SeekTarget;
import com.github.adamzv.kafkaadmin.domain.TopicSpec;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Checks admin requests before anything is sent to the cluster.
 *
 * <p>Rules run in a fixed order and the first one broken decides the error. A rule is checked
 * against every entry of a batch before the next rule starts, so a batch with a bad host in its
 * first entry and a bad principal in its last reports the principal.
 */
@Component
public class EnumValidator {

  public List<TopicSpec> createTopics(List<TopicSpec> topics) {
    if (topics == null) {
      throw invalid("Invalid topics array null", Map.of());
    }
    rejectFirst(topics, entry -> entry == null || isBlank(entry.topic()),
        entry -> "Invalid topics array, the topic names have to be a valid string");
    requireUnique(topics, TopicSpec::topic,
        "Invalid topics array, it cannot have multiple entries for the same topic");
    return List.copyOf(topics);
  }

  public List<String> deleteTopics(List<String> topics) {
    if (topics == null) {
      throw invalid("Invalid topics array null", Map.of());
    }
    rejectFirst(topics, EnumValidator::isBlank,
        topic -> "Invalid topics array, the names must be a valid string");
    return List.copyOf(topics);
  }

  public List<PartitionsSpec> createPartitions(List<PartitionsSpec> topicPartitions) {
    if (topicPartitions == null) {
      throw invalid("Invalid topic partitions array null", Map.of());
    }
    if (topicPartitions.isEmpty()) {
      throw invalid("Empty topic partitions array", Map.of());
    }
    rejectFirst(topicPartitions, entry -> entry == null || isBlank(entry.topic()),
        entry -> "Invalid topic partitions array, the topic names have to be a valid string");
    requireUnique(topicPartitions, PartitionsSpec::topic,
        "Invalid topic partitions array, it cannot have multiple entries for the same topic");
    return List.copyOf(topicPartitions);
  }

  public List<ConfigResourceRef> describeConfigs(List<ResourceConfigQuery> resources) {
    requireResources(resources);
    rejectFirst(resources, r -> r == null || resolve(ConfigResourceType.class, r.type()) == null,
        r -> "Invalid resource type " + (r == null ? null : r.type()) + ": " + r);
    rejectFirst(resources, r -> isBlank(r.name()),
        r -> "Invalid resource name " + r.name() + ": " + r);

    List<ConfigResourceRef> validated = new ArrayList<>(resources.size());
    for (ResourceConfigQuery resource : resources) {
      validated.add(new ConfigResourceRef(
          resolve(ConfigResourceType.class, resource.type()),
          resource.name(),
          resource.configNames() == null ? List.of() : List.copyOf(resource.configNames())
      ));
    }
    return List.copyOf(validated);
  }

  public List<ConfigResourceUpdate> alterConfigs(List<ResourceConfig> resources) {
    requireResources(resources);
    rejectFirst(resources, r -> r == null || resolve(ConfigResourceType.class, r.type()) == null,
        r -> "Invalid resource type " + (r == null ? null : r.type()) + ": " + r);
    rejectFirst(resources, r -> isBlank(r.name()),
        r -> "Invalid resource name " + r.name() + ": " + r);
    rejectFirst(resources, r -> r.configEntries() == null,
        r -> "Invalid resource configEntries null: " + r);
    rejectFirst(resources, r -> r.configEntries().stream().anyMatch(EnumValidator::isInvalidEntry),
        r -> "Invalid resource config value: " + r);

    List<ConfigResourceUpdate> validated = new ArrayList<>(resources.size());
    for (ResourceConfig resource : resources) {
      validated.add(new ConfigResourceUpdate(
          resolve(ConfigResourceType.class, resource.type()),
          resource.name(),
          List.copyOf(resource.configEntries())
      ));
    }
    return List.copyOf(validated);
  }

  public List<AclRule> createAcls(List<AclEntry> acl) {
    if (acl == null) {
      throw invalid("Invalid ACL array null", Map.of());
    }
    if (acl.isEmpty()) {
      throw invalid("Empty ACL array", Map.of());
    }

    rejectFirst(acl, entry -> entry == null || isBlank(entry.principal()),
        entry -> "Invalid ACL array, the principals have to be a valid string");
    rejectFirst(acl, entry -> isBlank(entry.host()),
        entry -> "Invalid ACL array, the hosts have to be a valid string");
    rejectFirst(acl, entry -> isBlank(entry.resourceName()),
        entry -> "Invalid ACL array, the resourceNames have to be a valid string");
    rejectFirst(acl, entry -> resolve(AclOperationType.class, entry.operation()) == null,
        entry -> "Invalid operation type " + entry.operation() + ": " + entry);
    rejectFirst(acl, entry -> resolve(ResourcePatternType.class, entry.resourcePatternType()) == null,
        entry -> "Invalid resource pattern type " + entry.resourcePatternType() + ": " + entry);
    rejectFirst(acl, entry -> resolve(PermissionType.class, entry.permissionType()) == null,
        entry -> "Invalid permission type " + entry.permissionType() + ": " + entry);
    rejectFirst(acl, entry -> resolve(AclResourceType.class, entry.resourceType()) == null,
        entry -> "Invalid resource type " + entry.resourceType() + ": " + entry);

    return acl.stream()
        .map(entry -> new AclRule(
            resolve(AclResourceType.class, entry.resourceType()),
            entry.resourceName(),
            resolve(ResourcePatternType.class, entry.resourcePatternType()),
            entry.principal(),
            entry.host(),
            resolve(AclOperationType.class, entry.operation()),
            resolve(PermissionType.class, entry.permissionType())))
        .toList();
  }

  /**
   * Validates a single describe filter. Principal, host and resource name may be null,
   * meaning "match any".
   */
  public AclRuleFilter describeAcls(AclFilter filter) {
    if (filter == null) {
      throw invalid("Invalid ACL filter null", Map.of());
    }
    if (isPresentButBlank(filter.principal())) {
      throw invalid("Invalid principal, the principal have to be a valid string", record(filter));
    }
    if (isPresentButBlank(filter.host())) {
      throw invalid("Invalid host, the host have to be a valid string", record(filter));
    }
    if (isPresentButBlank(filter.resourceName())) {
      throw invalid("Invalid resourceName, the resourceName have to be a valid string", record(filter));
    }
    if (resolve(AclOperationType.class, filter.operation()) == null) {
      throw invalid("Invalid operation type " + filter.operation(), record(filter));
    }
    if (resolve(ResourcePatternType.class, filter.resourcePatternType()) == null) {
      throw invalid("Invalid resource pattern filter type " + filter.resourcePatternType(), record(filter));
    }
    if (resolve(PermissionType.class, filter.permissionType()) == null) {
      throw invalid("Invalid permission type " + filter.permissionType(), record(filter));
    }
    if (resolve(AclResourceType.class, filter.resourceType()) == null) {
      throw invalid("Invalid resource type " + filter.resourceType(), record(filter));
    }
    return toRuleFilter(filter);
  }

  public List<AclRuleFilter> deleteAcls(List<AclFilter> filters) {
    if (filters == null) {
      throw invalid("Invalid ACL Filter array null", Map.of());
    }
    if (filters.isEmpty()) {
      throw invalid("Empty ACL Filter array", Map.of());
    }

    rejectFirst(filters, f -> f == null || isPresentButBlank(f.principal()),
        f -> "Invalid ACL Filter array, the principals have to be a valid string");
    rejectFirst(filters, f -> isPresentButBlank(f.host()),
        f -> "Invalid ACL Filter array, the hosts have to be a valid string");
    rejectFirst(filters, f -> isPresentButBlank(f.resourceName()),
        f -> "Invalid ACL Filter array, the resourceNames have to be a valid string");
    rejectFirst(filters, f -> resolve(AclOperationType.class, f.operation()) == null,
        f -> "Invalid operation type " + f.operation() + ": " + f);
    rejectFirst(filters, f -> resolve(ResourcePatternType.class, f.resourcePatternType()) == null,
        f -> "Invalid resource pattern type " + f.resourcePatternType() + ": " + f);
    rejectFirst(filters, f -> resolve(PermissionType.class, f.permissionType()) == null,
        f -> "Invalid permission type " + f.permissionType() + ": " + f);
    rejectFirst(filters, f -> resolve(AclResourceType.class, f.resourceType()) == null,
        f -> "Invalid resource type " + f.resourceType() + ": " + f);

    return filters.stream().map(EnumValidator::toRuleFilter).toList();
  }

  /**
   * Returns the distinct group ids in request order.
   */
  public List<String> groupIds(List<String> groupIds) {
    if (groupIds == null) {
      throw invalid("Invalid groupIds array null", Map.of());
    }
    if (groupIds.isEmpty()) {
      throw invalid("Empty groupIds array", Map.of());
    }
    rejectFirst(groupIds, EnumValidator::isBlank,
        groupId -> "Invalid groupId name: " + groupId);
    return List.copyOf(new LinkedHashSet<>(groupIds));
  }

  public String topic(String topic) {
    if (isBlank(topic)) {
      throw invalid("Invalid topic " + topic, record(topic));
    }
    return topic;
  }

  public List<String> topics(List<String> topics) {
    if (topics == null) {
      return List.of();
    }
    for (String topic : topics) {
      topic(topic);
    }
    return List.copyOf(topics);
  }

  public String groupId(String groupId) {
    if (isBlank(groupId)) {
      throw invalid("Invalid groupId " + groupId, record(groupId));
    }
    return groupId;
  }

  public List<SeekTarget> seekTargets(String topic, List<SeekEntry> partitions) {
    if (partitions == null || partitions.isEmpty()) {
      throw invalid("Invalid partitions", Map.of("topic", topic));
    }
    rejectFirst(partitions, entry -> entry == null || entry.partition() == null || entry.partition() < 0,
        entry -> "Invalid partition " + (entry == null ? null : entry.partition()) + ": " + entry);
    rejectFirst(partitions, entry -> entry.offset() == null || entry.offset() < SeekTarget.EARLIEST,
        entry -> "Invalid offset " + entry.offset() + ": " + entry);
    return partitions.stream()
        .map(entry -> new SeekTarget(topic, entry.partition(), entry.offset()))
        .toList();
  }

  private static void requireResources(List<?> resources) {
    if (resources == null) {
      throw invalid("Invalid resources array null", Map.of());
    }
    if (resources.isEmpty()) {
      throw invalid("Resources array cannot be empty", Map.of());
    }
  }

  private static <T> void requireUnique(List<T> entries, Function<T, String> key, String message) {
    Set<String> seen = new HashSet<>();
    for (T entry : entries) {
      if (!seen.add(key.apply(entry))) {
        throw invalid(message, record(entry));
      }
    }
  }

  private static AclRuleFilter toRuleFilter(AclFilter filter) {
    return new AclRuleFilter(
        resolve(AclResourceType.class, filter.resourceType()),
        filter.resourceName(),
        resolve(ResourcePatternType.class, filter.resourcePatternType()),
        filter.principal(),
        filter.host(),
        resolve(AclOperationType.class, filter.operation()),
        resolve(PermissionType.class, filter.permissionType())
    );
  }

  private static boolean isInvalidEntry(ConfigEntry entry) {
    return entry == null || entry.name() == null || entry.value() == null;
  }

  private static <T> void rejectFirst(List<T> entries, Predicate<T> violates, Function<T, String> message) {
    for (T entry : entries) {
      if (violates.test(entry)) {
        throw invalid(message.apply(entry), record(entry));
      }
    }
  }

  private static <E extends Enum<E> & ProtocolEnum> E resolve(Class<E> type, String raw) {
    return ProtocolEnum.resolve(type, raw);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static boolean isPresentButBlank(String value) {
    return value != null && value.isBlank();
  }

  private static Map<String, Object> record(Object entry) {
    Map<String, Object> details = new HashMap<>();
    details.put("record", entry == null ? null : String.valueOf(entry));
    return details;
  }

  private static ProblemException invalid(String message, Map<String, Object> details) {
    return Problems.invalidArgument(message, details);
  }
}
