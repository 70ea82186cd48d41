package com.flagship.member_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Markers of bank statement lines that were booked or skipped.
 */
@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    long countByConsumerGroup(String consumerGroup);

    long countByConsumerGroupAndProcessingResult(String consumerGroup, ProcessedEvent.ProcessingResult processingResult);

    @Query("SELECT MAX(p.processedAt) FROM ProcessedEventEntity p WHERE p.consumerGroup = :consumerGroup")
    Optional<Instant> findLastProcessedAt(@Param("consumerGroup") String consumerGroup);
}
