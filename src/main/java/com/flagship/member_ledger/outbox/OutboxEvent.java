package com.flagship.member_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A finance event waiting in (or already sent from) the outbox.
 *
 * Written in the same transaction as the ledger or mandate change it describes,
 * published to Kafka afterwards by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // Persona, LastschriftMandate, LastschriftTransaction
    String aggregateId;
    String eventType;
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until sent
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    /**
     * Kafka record key. Events of one aggregate share a partition and stay ordered.
     */
    public String partitionKey() {
        return aggregateType + ":" + aggregateId;
    }
}
