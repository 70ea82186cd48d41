package com.flagship.member_ledger.ledger;

import lombok.Value;

/**
 * Outcome of a ledger mutation: persona state before and after, and the log entry that
 * was appended with it in the same transaction.
 */
@Value
public class LedgerUpdate {
    Persona before;
    Persona after;
    FinanceLogEntry entry;
}
