package com.flagship.member_ledger.outbox;

import com.flagship.member_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import org.apache.kafka.clients.producer.ProducerRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Polls the outbox and publishes finance events to Kafka.
 *
 * 1. Lock a batch of unpublished events (FOR UPDATE SKIP LOCKED, so several
 *    instances can run side by side)
 * 2. Send each one synchronously, keyed by aggregate, with the event id, event type
 *    and aggregate type as record headers
 * 3. Mark it published, or count a retry on failure
 *
 * Events past {@code outbox.publisher.max-retries} are left for manual handling.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    public static final String EVENT_ID_HEADER = "event_id";
    public static final String EVENT_TYPE_HEADER = "event_type";
    public static final String AGGREGATE_TYPE_HEADER = "aggregate_type";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.finance-events:finance-events}")
    private String financeEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findUnpublishedEvents(batchSize);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Event {} has exceeded max retries ({}), leaving it for manual handling. eventType={}, aggregate={}",
                    event.getId(), maxRetries, event.getEventType(), event.partitionKey());
            outboxMetrics.recordEventGaveUp(event.getEventType());
            return;
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(toRecord(event)).get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        }
    }

    private ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
                new ProducerRecord<>(financeEventsTopic, event.partitionKey(), event.getPayload());
        record.headers()
                .add(EVENT_ID_HEADER, event.getId().toString().getBytes(StandardCharsets.UTF_8))
                .add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8))
                .add(AGGREGATE_TYPE_HEADER, event.getAggregateType().getBytes(StandardCharsets.UTF_8));
        return record;
    }

    /**
     * Runs one polling cycle immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
