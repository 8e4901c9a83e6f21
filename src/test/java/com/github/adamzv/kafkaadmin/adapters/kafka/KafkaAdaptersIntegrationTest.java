package com.github.adamzv.kafkaadmin.adapters.kafka;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.adamzv.kafkaadmin.application.AclAdministration;
import com.github.adamzv.kafkaadmin.application.ClusterAdmin;
import com.github.adamzv.kafkaadmin.application.ConditionWaiter;
import com.github.adamzv.kafkaadmin.application.ConfigAdministration;
import com.github.adamzv.kafkaadmin.application.EnumValidator;
import com.github.adamzv.kafkaadmin.application.GroupAdministration;
import com.github.adamzv.kafkaadmin.application.InstrumentationEmitter;
import com.github.adamzv.kafkaadmin.application.OffsetCoordinator;
import com.github.adamzv.kafkaadmin.application.RetryOrchestrator;
import com.github.adamzv.kafkaadmin.application.TopicAdministration;
import com.github.adamzv.kafkaadmin.domain.AdminTimeouts;
import com.github.adamzv.kafkaadmin.domain.AlterConfigsRequest;
import com.github.adamzv.kafkaadmin.domain.ClusterDescription;
import com.github.adamzv.kafkaadmin.domain.ConfigEntry;
import com.github.adamzv.kafkaadmin.domain.ConfigEntryDescription;
import com.github.adamzv.kafkaadmin.domain.CreatePartitionsRequest;
import com.github.adamzv.kafkaadmin.domain.CreateTopicsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteGroupsRequest;
import com.github.adamzv.kafkaadmin.domain.DeleteTopicsRequest;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsRequest;
import com.github.adamzv.kafkaadmin.domain.DescribeConfigsResponse;
import com.github.adamzv.kafkaadmin.domain.FetchOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.GroupDeletionResult;
import com.github.adamzv.kafkaadmin.domain.GroupListing;
import com.github.adamzv.kafkaadmin.domain.PartitionOffset;
import com.github.adamzv.kafkaadmin.domain.PartitionWatermarks;
import com.github.adamzv.kafkaadmin.domain.PartitionsSpec;
import com.github.adamzv.kafkaadmin.domain.ProblemCodes;
import com.github.adamzv.kafkaadmin.domain.ProblemException;
import com.github.adamzv.kafkaadmin.domain.ResetOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.ResourceConfig;
import com.github.adamzv.kafkaadmin.domain.ResourceConfigQuery;
import com.github.adamzv.kafkaadmin.domain.RetryPolicy;
import com.github.adamzv.kafkaadmin.domain.SeekEntry;
import com.github.adamzv.kafkaadmin.domain.SetOffsetsRequest;
import com.github.adamzv.kafkaadmin.domain.TopicSpec;
import com.github.adamzv.kafkaadmin.domain.TopicsMetadata;
import com.github.adamzv.kafkaadmin.support.KafkaProperties;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.apache.kafka.common.utils.Time;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

@Testcontainers(disabledWithoutDocker = true)
@Tag("integration")
class KafkaAdaptersIntegrationTest {

  private static final DockerImageName KAFKA_IMAGE = DockerImageName.parse("confluentinc/cp-kafka:7.5.0");

  @Container
  static final KafkaContainer KAFKA = new KafkaContainer(KAFKA_IMAGE)
      .withReuse(false);

  private static KafkaClusterAdapter cluster;
  private static ExecutorService fanOutExecutor;
  private static ClusterAdmin admin;

  @BeforeAll
  static void setUp() {
    KafkaProperties kafkaProperties = new KafkaProperties(KAFKA.getBootstrapServers(), "kafka-admin-itest");
    AdminTimeouts timeouts = new AdminTimeouts(
        Duration.ofSeconds(10),
        Duration.ofMillis(100),
        Duration.ofSeconds(20),
        Duration.ofSeconds(30),
        Duration.ofMinutes(5)
    );
    Time time = Time.SYSTEM;

    cluster = new KafkaClusterAdapter(kafkaProperties, timeouts, time);
    fanOutExecutor = Executors.newFixedThreadPool(4);

    EnumValidator validator = new EnumValidator();
    RetryOrchestrator retry = new RetryOrchestrator(RetryPolicy.defaults(), time);
    admin = new ClusterAdmin(
        cluster,
        new InstrumentationEmitter(time),
        validator,
        new TopicAdministration(cluster, retry, validator, new ConditionWaiter(time), timeouts),
        new ConfigAdministration(cluster, retry, validator),
        new AclAdministration(cluster, retry, validator),
        new GroupAdministration(cluster, retry, validator, fanOutExecutor),
        new OffsetCoordinator(cluster, retry, validator,
            new KafkaGroupConsumerProvider(kafkaProperties, cluster, timeouts), timeouts)
    );
    admin.connect();
  }

  @AfterAll
  static void tearDown() {
    if (admin != null) {
      admin.disconnect();
    }
    if (fanOutExecutor != null) {
      fanOutExecutor.shutdownNow();
    }
  }

  @Test
  void createTopicsWaitsForLeadersAndToleratesExistingTopics() {
    String topic = "create-demo";

    assertTrue(admin.createTopics(new CreateTopicsRequest(List.of(spec(topic, 2)), null, null, null)));
    assertTrue(admin.listTopics().contains(topic));

    TopicsMetadata metadata = admin.fetchTopicMetadata(List.of(topic));
    assertEquals(2, metadata.topics().get(0).partitionMetadata().size());
    assertTrue(metadata.topics().get(0).partitionMetadata().stream().allMatch(partition -> partition.leader() >= 0));

    assertFalse(admin.createTopics(new CreateTopicsRequest(List.of(spec(topic, 2)), null, null, null)));
  }

  @Test
  void describeClusterReportsController() {
    ClusterDescription description = admin.describeCluster();

    assertEquals(1, description.brokers().size());
    assertNotNull(description.controller());
    assertNotNull(description.clusterId());
  }

  @Test
  void createPartitionsAndDeleteTopic() {
    String topic = "partitions-demo";
    admin.createTopics(new CreateTopicsRequest(List.of(spec(topic, 1)), null, null, null));

    admin.createPartitions(new CreatePartitionsRequest(List.of(new PartitionsSpec(topic, 3, null)), false, null));
    assertEquals(3, admin.fetchTopicMetadata(List.of(topic)).topics().get(0).partitionMetadata().size());

    admin.deleteTopics(new DeleteTopicsRequest(List.of(topic), null));
    assertFalse(cluster.targetTopics().contains(topic));
  }

  @Test
  void alterConfigsIsVisibleInDescribeConfigs() {
    String topic = "config-demo";
    admin.createTopics(new CreateTopicsRequest(List.of(spec(topic, 1)), null, null, null));

    admin.alterConfigs(new AlterConfigsRequest(List.of(
        new ResourceConfig("TOPIC", topic, List.of(new ConfigEntry("retention.ms", "3600000")))), false));

    DescribeConfigsResponse response = admin.describeConfigs(new DescribeConfigsRequest(
        List.of(new ResourceConfigQuery("TOPIC", topic, List.of("retention.ms"))), false));

    List<ConfigEntryDescription> entries = response.resources().get(0).configEntries();
    assertEquals(1, entries.size());
    assertEquals("3600000", entries.get(0).value());
  }

  @Test
  void fetchTopicOffsetsReportsWatermarks() throws Exception {
    String topic = "offsets-demo";
    admin.createTopics(new CreateTopicsRequest(List.of(spec(topic, 1)), null, null, null));
    produce(topic, 1, 4);

    List<PartitionWatermarks> watermarks = admin.fetchTopicOffsets(topic);

    assertEquals(1, watermarks.size());
    assertEquals(4L, watermarks.get(0).high());
    assertEquals(0L, watermarks.get(0).low());
    assertEquals(watermarks.get(0).high(), watermarks.get(0).offset());
  }

  @Test
  void setOffsetsCommitsPositionsOfIdleGroup() throws Exception {
    String topic = "set-offsets-demo";
    String groupId = "set-offsets-group";
    admin.createTopics(new CreateTopicsRequest(List.of(spec(topic, 2)), null, null, null));
    produce(topic, 2, 5);

    admin.setOffsets(new SetOffsetsRequest(groupId, topic, List.of(new SeekEntry(0, 1L), new SeekEntry(1, 2L))));

    List<PartitionOffset> committed = admin.fetchOffsets(new FetchOffsetsRequest(groupId, topic));
    assertEquals(List.of(1L, 2L), committed.stream().map(PartitionOffset::offset).toList());

    admin.resetOffsets(new ResetOffsetsRequest(groupId, topic, true));
    List<PartitionOffset> reset = admin.fetchOffsets(new FetchOffsetsRequest(groupId, topic));
    assertTrue(reset.stream().allMatch(offset -> offset.offset() == 0L));

    assertTrue(admin.listGroups().groups().stream().map(GroupListing::groupId).anyMatch(groupId::equals));

    List<GroupDeletionResult> deleted = admin.deleteGroups(new DeleteGroupsRequest(List.of(groupId)));
    assertEquals(1, deleted.size());
    assertTrue(deleted.get(0).succeeded());
  }

  @Test
  void setOffsetsRefusesGroupWithRunningMember() throws Exception {
    String topic = "running-group-demo";
    String groupId = "running-group";
    admin.createTopics(new CreateTopicsRequest(List.of(spec(topic, 1)), null, null, null));

    Properties consumerProps = new Properties();
    consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
    consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());

    try (KafkaConsumer<String, String> consumer = new KafkaConsumer<>(consumerProps)) {
      consumer.subscribe(List.of(topic));
      long deadline = System.currentTimeMillis() + 15_000;
      while (consumer.assignment().isEmpty() && System.currentTimeMillis() < deadline) {
        consumer.poll(Duration.ofMillis(200));
      }

      ProblemException ex = assertThrows(ProblemException.class, () -> admin.setOffsets(
          new SetOffsetsRequest(groupId, topic, List.of(new SeekEntry(0, 0L)))));
      assertEquals(ProblemCodes.INVALID_STATE, ex.code());
    }
  }

  @Test
  @SuppressWarnings("deprecation")
  void trackedTopicDeletedElsewhereIsUntrackedOnRefresh() throws Exception {
    String topic = "vanishing-demo";
    admin.createTopics(new CreateTopicsRequest(List.of(spec(topic, 1)), null, null, null));
    admin.getTopicMetadata(List.of(topic));
    assertTrue(cluster.targetTopics().contains(topic));

    Properties adminProps = new Properties();
    adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
    try (Admin external = Admin.create(adminProps)) {
      external.deleteTopics(List.of(topic)).all().get(10, TimeUnit.SECONDS);
      long deadline = System.currentTimeMillis() + 15_000;
      while (external.listTopics().names().get(10, TimeUnit.SECONDS).contains(topic)
          && System.currentTimeMillis() < deadline) {
        Thread.sleep(200);
      }
    }

    assertTrue(admin.createTopics(new CreateTopicsRequest(List.of(spec("after-vanishing-demo", 1)), null, null, null)));
    assertFalse(cluster.targetTopics().contains(topic));
  }

  private static TopicSpec spec(String topic, int partitions) {
    return new TopicSpec(topic, partitions, (short) 1, null, null);
  }

  private static void produce(String topic, int partitions, int recordsPerPartition) throws Exception {
    Properties producerProps = new Properties();
    producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, KAFKA.getBootstrapServers());
    producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());

    try (KafkaProducer<String, String> producer = new KafkaProducer<>(producerProps)) {
      for (int partition = 0; partition < partitions; partition++) {
        for (int i = 0; i < recordsPerPartition; i++) {
          producer.send(new ProducerRecord<>(topic, partition, "key-" + i, "message-" + i))
              .get(10, TimeUnit.SECONDS);
        }
      }
    }
  }
}
