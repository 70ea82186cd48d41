package com.flagship.member_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One row of the append-only finance log.
 *
 * Entries that change a balance carry {@code delta} and {@code newBalance}; pure status
 * entries (mandate granted, membership lost) leave both null. {@code members},
 * {@code total} and {@code memberTotal} snapshot the association-wide figures after the
 * change; a total of -1 means it was not computed.
 */
@Value
public class FinanceLogEntry {
    Long id;
    Instant ctime;
    FinanceLogCode code;
    Long submittedBy;
    Long personaId;
    BigDecimal delta;
    BigDecimal newBalance;
    LocalDate transactionDate;
    String changeNote;
    int members;
    BigDecimal total;
    BigDecimal memberTotal;

    public boolean changesBalance() {
        return delta != null;
    }
}
