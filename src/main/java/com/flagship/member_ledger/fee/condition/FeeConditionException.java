package com.flagship.member_ledger.fee.condition;

import lombok.Getter;

/**
 * A fee condition that cannot be saved: bad syntax or references to fields or parts
 * the event does not have.
 */
@Getter
public class FeeConditionException extends IllegalArgumentException {

    /** Zero-based character offset of the offending token, or -1 for reference errors. */
    private final int position;

    public FeeConditionException(String message, int position) {
        super(position >= 0 ? message + " (at position " + position + ")" : message);
        this.position = position;
    }

    public FeeConditionException(String message) {
        this(message, -1);
    }
}
