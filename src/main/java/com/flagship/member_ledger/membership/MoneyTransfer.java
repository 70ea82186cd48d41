package com.flagship.member_ledger.membership;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One line of a bank statement: money a persona sent to the association.
 */
@Value
public class MoneyTransfer {
    Long personaId;
    BigDecimal amount;
    LocalDate transactionDate;
    String note;
}
