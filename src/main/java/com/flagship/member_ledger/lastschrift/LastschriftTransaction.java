package com.flagship.member_ledger.lastschrift;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One collection attempt on a mandate.
 *
 * {@code tally} is what the association actually gained or lost: the amount on
 * success, nothing on cancellation, minus the bank's fee on failure or rollback. It
 * stays null while the transaction is open.
 */
@Value
public class LastschriftTransaction {

    public static final String AGGREGATE_TYPE = "LastschriftTransaction";

    Long id;
    Long mandateId;
    Integer periodId;
    Instant issuedAt;
    LocalDate paymentDate;
    BigDecimal amount;
    BigDecimal tally;
    Instant processedAt;
    TransactionStatus status;
    Long submittedBy;
    Long version;

    /**
     * A new OPEN transaction.
     *
     * @throws IllegalArgumentException if the amount is not positive
     */
    public static LastschriftTransaction issue(Long mandateId, Integer periodId, BigDecimal amount,
                                               LocalDate paymentDate, Long submittedBy) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Direct debit amount must be positive: " + amount);
        }
        return new LastschriftTransaction(null, mandateId, periodId, Instant.now(), paymentDate,
            amount.setScale(2), null, null, TransactionStatus.OPEN, submittedBy, null);
    }

    /**
     * A SKIPPED pseudo transaction: nothing is collected, but the billing year counts
     * as handled for this mandate.
     */
    public static LastschriftTransaction skipped(Long mandateId, Integer periodId, Long submittedBy) {
        Instant now = Instant.now();
        BigDecimal zero = BigDecimal.ZERO.setScale(2);
        return new LastschriftTransaction(null, mandateId, periodId, now, null, zero, zero, now,
            TransactionStatus.SKIPPED, submittedBy, null);
    }

    /**
     * Applies the bank's answer.
     *
     * @param rollbackFee what the bank charges for a returned debit
     * @throws IllegalStateException if the transaction is not OPEN
     */
    public LastschriftTransaction finalizeWith(TransactionOutcome outcome, BigDecimal rollbackFee) {
        if (status != TransactionStatus.OPEN) {
            throw new IllegalStateException(String.format(
                "Transaction %d is already %s", id, status));
        }
        BigDecimal newTally = switch (outcome) {
            case SUCCESS -> amount;
            case FAILURE -> rollbackFee.negate();
            case CANCELLED -> BigDecimal.ZERO.setScale(2);
        };
        return withResult(outcome.getStatus(), newTally);
    }

    /**
     * Records a charge back of a successful debit.
     *
     * @throws IllegalStateException if the transaction is not SUCCESS
     */
    public LastschriftTransaction rollback(BigDecimal rollbackFee) {
        if (status != TransactionStatus.SUCCESS) {
            throw new IllegalStateException(String.format(
                "Only successful transactions can be rolled back, transaction %d is %s", id, status));
        }
        return withResult(TransactionStatus.ROLLBACK, rollbackFee.negate());
    }

    public boolean isOpen() {
        return status == TransactionStatus.OPEN;
    }

    private LastschriftTransaction withResult(TransactionStatus newStatus, BigDecimal newTally) {
        return new LastschriftTransaction(id, mandateId, periodId, issuedAt, paymentDate, amount, newTally,
            Instant.now(), newStatus, submittedBy, version);
    }
}
