package com.flagship.member_ledger.lastschrift.sepa;

import com.flagship.member_ledger.lastschrift.BatchItemError;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A rendered pain.008 file together with what went into it and what was left out.
 */
@Value
public class SepaPainDocument {
    String messageId;
    String xml;
    int numberOfTransactions;
    BigDecimal controlSum;
    List<SepaDirectDebit> included;
    List<BatchItemError> excluded;

    public boolean isEmpty() {
        return included.isEmpty();
    }
}
