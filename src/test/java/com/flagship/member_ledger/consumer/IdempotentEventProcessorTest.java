package com.flagship.member_ledger.consumer;

import com.flagship.member_ledger.ledger.Persona;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * At-most-once application of consumed messages.
 */
@SpringBootTest
@Testcontainers
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("member_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "MoneyTransferReceived";
    private static final String AGGREGATE_ID = "42";

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("First delivery runs the handler and is recorded")
    void testFirstEventProcessing_ExecutesHandler() {
        printTestHeader("First Event Processing");

        UUID eventId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        boolean processed = eventProcessor.processEvent(
            eventId, EVENT_TYPE, Persona.AGGREGATE_TYPE, AGGREGATE_ID, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet
        );

        System.out.println("Processed: " + processed);
        assertTrue(processed);
        assertEquals(1, handlerCallCount.get());

        ProcessedEventEntity entity = repository.findById(eventId).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, entity.getProcessingResult());
        assertEquals(AGGREGATE_ID, entity.getAggregateId());

        printSuccess("First event processed and recorded");
    }

    @Test
    @DisplayName("Redelivered events do not run the handler again")
    void testDuplicateEvent_SkipsHandler() {
        printTestHeader("Duplicate Event");

        UUID eventId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        boolean first = eventProcessor.processEvent(
            eventId, EVENT_TYPE, Persona.AGGREGATE_TYPE, AGGREGATE_ID, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet);
        boolean second = eventProcessor.processEvent(
            eventId, EVENT_TYPE, Persona.AGGREGATE_TYPE, AGGREGATE_ID, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet);

        assertTrue(first);
        assertFalse(second);
        assertEquals(1, handlerCallCount.get());

        printSuccess("Duplicate skipped");
    }

    @Test
    @DisplayName("A failing handler leaves no marker, so the event is retried")
    void testFailedProcessing_IsRetried() {
        printTestHeader("Failed Processing");

        UUID eventId = UUID.randomUUID();

        assertThrows(RuntimeException.class, () -> eventProcessor.processEvent(
            eventId, EVENT_TYPE, Persona.AGGREGATE_TYPE, AGGREGATE_ID, CONSUMER_GROUP,
            () -> {
                throw new RuntimeException("Simulated processing failure");
            }));

        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        AtomicInteger handlerCallCount = new AtomicInteger(0);
        assertTrue(eventProcessor.processEvent(
            eventId, EVENT_TYPE, Persona.AGGREGATE_TYPE, AGGREGATE_ID, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet));
        assertEquals(1, handlerCallCount.get());

        printSuccess("Failed event retried");
    }

    @Test
    @DisplayName("Concurrent deliveries of one event run the handler once")
    void testConcurrentProcessing_OnlyOnce() throws InterruptedException {
        printTestHeader("Concurrent Processing");

        UUID eventId = UUID.randomUUID();
        AtomicInteger committed = new AtomicInteger(0);

        int threadCount = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (eventProcessor.processEvent(
                            eventId, EVENT_TYPE, Persona.AGGREGATE_TYPE, AGGREGATE_ID, CONSUMER_GROUP,
                            () -> { })) {
                        committed.incrementAndGet();
                    }
                } catch (Exception e) {
                    // losing inserts fail on the primary key
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        doneLatch.await();
        executor.shutdown();

        System.out.println("Committed: " + committed.get());
        assertEquals(1, committed.get());
        assertEquals(1, repository.countByConsumerGroup(CONSUMER_GROUP));

        printSuccess("Only one delivery committed");
    }

    @Test
    @DisplayName("A skipped event is never processed")
    void testSkipEvent_PreventsFutureProcessing() {
        printTestHeader("Skip Event");

        UUID eventId = UUID.randomUUID();
        AtomicInteger handlerCallCount = new AtomicInteger(0);

        eventProcessor.skipEvent(eventId, EVENT_TYPE, Persona.AGGREGATE_TYPE, AGGREGATE_ID, CONSUMER_GROUP,
            "Persona not found: 42");
        eventProcessor.skipEvent(eventId, EVENT_TYPE, Persona.AGGREGATE_TYPE, AGGREGATE_ID, CONSUMER_GROUP,
            "again");

        boolean processed = eventProcessor.processEvent(
            eventId, EVENT_TYPE, Persona.AGGREGATE_TYPE, AGGREGATE_ID, CONSUMER_GROUP,
            handlerCallCount::incrementAndGet);

        assertFalse(processed);
        assertEquals(0, handlerCallCount.get());
        ProcessedEventEntity entity = repository.findById(eventId).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, entity.getProcessingResult());
        assertEquals("Persona not found: 42", entity.getErrorMessage());

        printSuccess("Skipped event stays skipped");
    }
}
