package com.flagship.member_ledger.event;

import com.flagship.member_ledger.lastschrift.LastschriftTransaction;
import com.flagship.member_ledger.lastschrift.TransactionStatus;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A direct debit reached a final status (SUCCESS, FAILURE, CANCELLED or ROLLBACK).
 *
 * {@code tally} is what the organisation actually gained or lost by it.
 */
@Value
public class LastschriftTransactionFinalizedEvent implements FinanceEvent {
    UUID eventId;
    Long transactionId;
    Long mandateId;
    Long personaId;
    TransactionStatus status;
    BigDecimal amount;
    BigDecimal tally;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LastschriftTransactionFinalized";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return LastschriftTransaction.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return transactionId.toString();
    }

    public static LastschriftTransactionFinalizedEvent from(LastschriftTransaction transaction, Long personaId) {
        return new LastschriftTransactionFinalizedEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getMandateId(),
            personaId,
            transaction.getStatus(),
            transaction.getAmount(),
            transaction.getTally(),
            Instant.now()
        );
    }
}
