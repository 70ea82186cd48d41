package com.flagship.member_ledger.lastschrift;

/**
 * Status of a direct debit transaction.
 *
 * OPEN moves to SUCCESS, FAILURE or CANCELLED once the bank has answered. A SUCCESS
 * the debtor's bank charges back later becomes ROLLBACK. SKIPPED marks a pseudo
 * transaction recorded instead of a debit.
 */
public enum TransactionStatus {
    OPEN,
    SUCCESS,
    FAILURE,
    CANCELLED,
    SKIPPED,
    ROLLBACK;

    public boolean isFinal() {
        return this != OPEN;
    }
}
