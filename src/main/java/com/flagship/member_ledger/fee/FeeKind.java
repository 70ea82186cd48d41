package com.flagship.member_ledger.fee;

/**
 * Category of a fee definition, used for statistics and to split donations out of the
 * participation fee.
 */
public enum FeeKind {
    REGULAR,
    REDUCED,
    SURCHARGE,
    DISCOUNT,
    STORNO,
    EXTERNAL,
    INSTRUCTOR_REFUND,
    INSTRUCTOR_DONATION,
    SOLIDARY_REDUCTION,
    SOLIDARY_DONATION,
    SOLIDARY_INCREASE,
    OTHER_DONATION;

    public boolean isDonation() {
        return this == INSTRUCTOR_DONATION || this == SOLIDARY_DONATION || this == OTHER_DONATION;
    }
}
