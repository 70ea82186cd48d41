package com.flagship.member_ledger.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * Always inserted, never merged: a concurrent delivery of the same event fails on the
 * primary key instead of overwriting the first marker.
 */
@Entity
@Table(name = "processed_events")
@Getter
@Setter
@NoArgsConstructor
public class ProcessedEventEntity implements Persistable<UUID> {

    @Id
    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "aggregate_type", nullable = false, length = 100)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, length = 100)
    private String aggregateId;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", length = 50)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Transient
    private boolean persisted;

    @Override
    public UUID getId() {
        return eventId;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.persisted = true;
    }

    public static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        ProcessedEventEntity entity = new ProcessedEventEntity();
        entity.setEventId(event.getEventId());
        entity.setEventType(event.getEventType());
        entity.setAggregateType(event.getAggregateType());
        entity.setAggregateId(event.getAggregateId());
        entity.setConsumerGroup(event.getConsumerGroup());
        entity.setProcessedAt(event.getProcessedAt());
        entity.setProcessingResult(event.getResult());
        entity.setErrorMessage(event.getErrorMessage());
        return entity;
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(
            this.eventId,
            this.eventType,
            this.aggregateType,
            this.aggregateId,
            this.consumerGroup,
            this.processedAt,
            this.processingResult,
            this.errorMessage
        );
    }
}
