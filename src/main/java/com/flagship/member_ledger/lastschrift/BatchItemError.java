package com.flagship.member_ledger.lastschrift;

import lombok.Value;

/**
 * An item a batch operation did not process, and why.
 */
@Value
public class BatchItemError {

    public enum Code {
        UNKNOWN_MANDATE,
        MANDATE_REVOKED,
        OPEN_TRANSACTION_EXISTS,
        ALREADY_DEBITED_THIS_PERIOD,
        NON_POSITIVE_AMOUNT,
        UNKNOWN_TRANSACTION,
        ALREADY_FINAL,
        INVALID_SEPA_DATA,
        ITEM_FAILED
    }

    Long itemId;
    Code code;
    String message;
}
