package com.flagship.member_ledger.lastschrift.sepa;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One DrctDbtTxInf entry, with all text fields already restricted to the SEPA
 * character set.
 */
@Value
public class SepaDirectDebit {
    Long transactionId;
    Long mandateId;
    String endToEndId;
    String mandateReference;
    LocalDate mandateDate;
    BigDecimal amount;
    String debtorName;
    String debtorIban;
    String remittance;
    SequenceType sequenceType;
    LocalDate collectionDate;
}
