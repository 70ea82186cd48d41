package com.flagship.member_ledger.fee;

/**
 * Status of a registrant in one part of an event.
 */
public enum RegistrationPartStatus {
    NOT_APPLIED,
    APPLIED,
    PARTICIPANT,
    WAITLIST,
    GUEST,
    CANCELLED,
    REJECTED;

    /**
     * Whether the registrant owes the participation fee for this part. Guests are
     * present on site but do not pay.
     */
    public boolean hasToPay() {
        return this == APPLIED || this == PARTICIPANT || this == WAITLIST;
    }
}
