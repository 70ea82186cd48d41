package com.flagship.member_ledger.outbox;

import com.flagship.member_ledger.lastschrift.Mandate;
import com.flagship.member_ledger.lastschrift.MandateService;
import com.flagship.member_ledger.ledger.FinanceActor;
import com.flagship.member_ledger.membership.MembershipService;
import com.flagship.member_ledger.membership.PersonaService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox publishing against a real broker.
 */
@SpringBootTest
@Testcontainers
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("member_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("consumer.enabled", () -> "false");
        // scheduled polling effectively off, publishing is triggered by the tests
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private MembershipService membershipService;

    @Autowired
    private MandateService mandateService;

    @Autowired
    private PersonaService personaService;

    @Value("${kafka.topic.finance-events:finance-events}")
    private String financeEventsTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(financeEventsTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Long newPersona(String givenNames) {
        return personaService.createPersona(givenNames, "Kafka", false, false, FinanceActor.system()).getId();
    }

    @Test
    @DisplayName("Published events reach the topic keyed by aggregate")
    void testPublisher_SendsToKafka() {
        printTestHeader("Publisher Sends Events");

        Long personaId = newPersona("Paula");
        membershipService.changeMembership(personaId, true, FinanceActor.system(), null);
        assertEquals(1, outboxService.countUnpublished());

        outboxPublisher.triggerPublish();

        assertEquals(0, outboxService.countUnpublished());
        List<ConsumerRecord<String, String>> records = consumeRecords("Persona:" + personaId, 1, 10000);
        System.out.println("Records received: " + records.size());

        assertEquals(1, records.size());
        assertTrue(records.get(0).value().contains("MembershipChanged"));
        assertTrue(records.get(0).value().contains("GAIN_MEMBERSHIP"));
        assertEquals("MembershipChanged", new String(
            records.get(0).headers().lastHeader(OutboxPublisher.EVENT_TYPE_HEADER).value(), StandardCharsets.UTF_8));
        assertEquals("Persona", new String(
            records.get(0).headers().lastHeader(OutboxPublisher.AGGREGATE_TYPE_HEADER).value(), StandardCharsets.UTF_8));

        printSuccess("Event published and marked");
    }

    @Test
    @DisplayName("Events of one aggregate share a partition and keep their order")
    void testPublisher_OrderPerAggregate() {
        printTestHeader("Order Per Aggregate");

        Long personaId = newPersona("Quirin");
        Mandate mandate = mandateService.grant(personaId, null, "DE89370400440532013000", null, null, null,
            FinanceActor.system());
        membershipService.changeMembership(personaId, true, FinanceActor.system(), null);
        membershipService.changeMembership(personaId, false, FinanceActor.system(), "Austritt");

        outboxPublisher.triggerPublish();

        List<ConsumerRecord<String, String>> records = consumeRecords("Persona:" + personaId, 2, 10000);
        assertEquals(2, records.size());
        assertEquals(records.get(0).partition(), records.get(1).partition());
        assertTrue(records.get(0).offset() < records.get(1).offset());
        assertTrue(records.get(0).value().contains("GAIN_MEMBERSHIP"));
        assertTrue(records.get(1).value().contains("LOSE_MEMBERSHIP"));

        List<ConsumerRecord<String, String>> revoked = consumeRecords(
            Mandate.AGGREGATE_TYPE + ":" + mandate.getId(), 1, 10000);
        assertEquals(1, revoked.size());
        assertTrue(revoked.get(0).value().contains("MandateRevoked"));

        printSuccess("Per-aggregate ordering kept");
    }

    @Test
    @DisplayName("Events past the retry limit are left for manual handling")
    void testPublisher_SkipsExhaustedEvents() {
        printTestHeader("Retry Limit");

        Long personaId = newPersona("Rita");
        membershipService.changeMembership(personaId, true, FinanceActor.system(), null);
        OutboxEvent event = outboxService.findUnpublishedEvents(10).get(0);
        for (int i = 0; i < 5; i++) {
            outboxService.markFailed(event.getId(), "Broker not available");
        }

        outboxPublisher.triggerPublish();

        assertEquals(1, outboxService.countUnpublished());
        assertTrue(consumeRecords("Persona:" + personaId, 1, 3000).isEmpty());

        printSuccess("Exhausted event not sent");
    }

    private List<ConsumerRecord<String, String>> consumeRecords(String key, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && matching.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            }
        }

        return matching;
    }
}
