package com.flagship.member_ledger.ledger;

/**
 * A ledger invariant would be broken: a negative balance, or a balance that does not
 * match its log entry. Never caught by batch code, so the enclosing transaction rolls
 * back as a whole.
 */
public class LedgerConsistencyException extends RuntimeException {

    public LedgerConsistencyException(String message) {
        super(message);
    }
}
