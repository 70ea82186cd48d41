package com.flagship.member_ledger.ledger;

/**
 * Kind of a finance log entry.
 *
 * The numeric codes are stable and shared with the reporting exports.
 */
public enum FinanceLogCode {
    NEW_MEMBER(1),
    GAIN_MEMBERSHIP(2),
    LOSE_MEMBERSHIP(3),
    INCREASE_BALANCE(10),
    DEDUCT_MEMBERSHIP_FEE(11),
    END_TRIAL_MEMBERSHIP(12),
    MANUAL_BALANCE_CORRECTION(13),
    REMOVE_BALANCE_ON_ARCHIVAL(14),
    START_TRIAL_MEMBERSHIP(15),
    GRANT_LASTSCHRIFT(20),
    REVOKE_LASTSCHRIFT(21),
    MODIFY_LASTSCHRIFT(22),
    LASTSCHRIFT_DELETED(23),
    LASTSCHRIFT_TRANSACTION_ISSUE(30),
    LASTSCHRIFT_TRANSACTION_SUCCESS(31),
    LASTSCHRIFT_TRANSACTION_FAILURE(32),
    LASTSCHRIFT_TRANSACTION_SKIP(33),
    LASTSCHRIFT_TRANSACTION_CANCELLED(34),
    LASTSCHRIFT_TRANSACTION_REVOKED(35),
    OTHER(99);

    private final int code;

    FinanceLogCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
