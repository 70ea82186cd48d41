package com.flagship.member_ledger.lastschrift;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * JPA entity for direct debit transactions.
 *
 * Only status, tally and processed_at change after insert. The version column turns
 * two concurrent finalizations of the same transaction into an optimistic lock
 * failure instead of a double booking.
 */
@Entity
@Table(
    name = "lastschrift_transactions",
    indexes = {
        @Index(name = "idx_lastschrift_transactions_mandate", columnList = "lastschrift_id"),
        @Index(name = "idx_lastschrift_transactions_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LastschriftTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "lastschrift_id", nullable = false, updatable = false)
    private Long mandateId;

    @Column(name = "period_id", nullable = false, updatable = false)
    private Integer periodId;

    @Column(name = "issued_at", nullable = false, updatable = false)
    private Instant issuedAt;

    @Column(name = "payment_date", updatable = false)
    private LocalDate paymentDate;

    @Column(nullable = false, updatable = false, precision = 8, scale = 2)
    private BigDecimal amount;

    @Column(precision = 8, scale = 2)
    private BigDecimal tally;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionStatus status;

    @Column(name = "submitted_by", updatable = false)
    private Long submittedBy;

    @Version
    private Long version;

    static LastschriftTransactionEntity fromDomain(LastschriftTransaction transaction) {
        return new LastschriftTransactionEntity(
            null, // assigned by the database
            transaction.getMandateId(),
            transaction.getPeriodId(),
            transaction.getIssuedAt(),
            transaction.getPaymentDate(),
            transaction.getAmount(),
            transaction.getTally(),
            transaction.getProcessedAt(),
            transaction.getStatus(),
            transaction.getSubmittedBy(),
            null
        );
    }

    public LastschriftTransaction toDomain() {
        return new LastschriftTransaction(id, mandateId, periodId, issuedAt, paymentDate, amount, tally,
            processedAt, status, submittedBy, version);
    }

    void updateFromDomain(LastschriftTransaction transaction) {
        this.status = transaction.getStatus();
        this.tally = transaction.getTally();
        this.processedAt = transaction.getProcessedAt();
    }
}
