package com.flagship.member_ledger.event;

import com.flagship.member_ledger.lastschrift.LastschriftTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A direct debit was issued and waits to be sent to the bank.
 */
@Value
public class LastschriftTransactionIssuedEvent implements FinanceEvent {
    UUID eventId;
    Long transactionId;
    Long mandateId;
    Long personaId;
    BigDecimal amount;
    LocalDate paymentDate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LastschriftTransactionIssued";

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

    public static LastschriftTransactionIssuedEvent from(LastschriftTransaction transaction, Long personaId) {
        return new LastschriftTransactionIssuedEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getMandateId(),
            personaId,
            transaction.getAmount(),
            transaction.getPaymentDate(),
            Instant.now()
        );
    }
}
