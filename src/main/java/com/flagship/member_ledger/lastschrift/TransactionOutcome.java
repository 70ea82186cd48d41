package com.flagship.member_ledger.lastschrift;

import com.flagship.member_ledger.ledger.FinanceLogCode;

/**
 * What the bank reported for an open transaction.
 */
public enum TransactionOutcome {
    SUCCESS(TransactionStatus.SUCCESS, FinanceLogCode.LASTSCHRIFT_TRANSACTION_SUCCESS),
    FAILURE(TransactionStatus.FAILURE, FinanceLogCode.LASTSCHRIFT_TRANSACTION_FAILURE),
    CANCELLED(TransactionStatus.CANCELLED, FinanceLogCode.LASTSCHRIFT_TRANSACTION_CANCELLED);

    private final TransactionStatus status;
    private final FinanceLogCode logCode;

    TransactionOutcome(TransactionStatus status, FinanceLogCode logCode) {
        this.status = status;
        this.logCode = logCode;
    }

    public TransactionStatus getStatus() {
        return status;
    }

    public FinanceLogCode getLogCode() {
        return logCode;
    }
}
