package com.flagship.member_ledger.membership;

import lombok.Getter;

/**
 * A line of a money transfer batch was rejected. Nothing of the batch is committed.
 */
@Getter
public class MoneyTransferBatchException extends IllegalArgumentException {

    /** Zero-based index of the rejected line. */
    private final int lineIndex;

    public MoneyTransferBatchException(int lineIndex, RuntimeException cause) {
        super("Line " + (lineIndex + 1) + ": " + cause.getMessage(), cause);
        this.lineIndex = lineIndex;
    }
}
