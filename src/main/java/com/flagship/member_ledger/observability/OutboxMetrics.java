package com.flagship.member_ledger.observability;

import com.flagship.member_ledger.consumer.MoneyTransferConsumer;
import com.flagship.member_ledger.consumer.ProcessedEvent;
import com.flagship.member_ledger.consumer.ProcessedEventRepository;
import com.flagship.member_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges and counters for both ends of the finance messaging.
 *
 * Outgoing: finance events waiting in the outbox, the age of the oldest one, and
 * events past the retry limit. Incoming: bank statement lines that were skipped
 * instead of booked, and the time since the last line was consumed.
 *
 * Gauges read cached values that {@link MetricsScheduler} refreshes, so a scrape
 * never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final ProcessedEventRepository processedEventRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong pendingFinanceEvents = new AtomicLong(0);
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong(0);
    private final AtomicLong stuckFinanceEvents = new AtomicLong(0);
    private final AtomicLong skippedBankLines = new AtomicLong(0);
    private final AtomicLong lastBankLineAgeSeconds = new AtomicLong(-1);

    @PostConstruct
    public void init() {
        Gauge.builder("finance.events.pending", pendingFinanceEvents, AtomicLong::get)
                .description("Finance events not yet published to Kafka")
                .register(meterRegistry);

        Gauge.builder("finance.events.pending.age.seconds", oldestPendingAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished finance event")
                .register(meterRegistry);

        Gauge.builder("finance.events.stuck", stuckFinanceEvents, AtomicLong::get)
                .description("Finance events that reached the retry limit")
                .register(meterRegistry);

        Gauge.builder("money_transfers.skipped", skippedBankLines, AtomicLong::get)
                .description("Bank statement lines that could not be booked")
                .register(meterRegistry);

        Gauge.builder("money_transfers.last.age.seconds", lastBankLineAgeSeconds, AtomicLong::get)
                .description("Seconds since the last bank statement line was consumed, -1 if none")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            pendingFinanceEvents.set(outboxRepository.countUnpublished());
            oldestPendingAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L));
            stuckFinanceEvents.set(outboxRepository.countByRetryCountGreaterThanEqual(maxRetries));

            skippedBankLines.set(processedEventRepository.countByConsumerGroupAndProcessingResult(
                    MoneyTransferConsumer.CONSUMER_GROUP, ProcessedEvent.ProcessingResult.SKIPPED));
            lastBankLineAgeSeconds.set(processedEventRepository.findLastProcessedAt(MoneyTransferConsumer.CONSUMER_GROUP)
                    .map(last -> Math.max(0, Duration.between(last, Instant.now()).getSeconds()))
                    .orElse(-1L));

            log.debug("Messaging metrics refreshed: pending={}, stuck={}, skippedBankLines={}",
                    pendingFinanceEvents.get(), stuckFinanceEvents.get(), skippedBankLines.get());
        } catch (DataAccessException e) {
            log.warn("Failed to refresh messaging metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("finance.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("finance.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventGaveUp(String eventType) {
        meterRegistry.counter("finance.events.gave_up", "event_type", eventType).increment();
    }
}
