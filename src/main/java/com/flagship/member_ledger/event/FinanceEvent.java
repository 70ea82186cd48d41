package com.flagship.member_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about balances, memberships or direct debits, published to the
 * finance-events topic through the outbox.
 */
public interface FinanceEvent {

    /** Unique per event instance; consumers deduplicate on it. */
    UUID getEventId();

    Instant getOccurredAt();

    String getEventType();

    /** Persona, LastschriftMandate or LastschriftTransaction. */
    String getAggregateType();

    String getAggregateId();
}
