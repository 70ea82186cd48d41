package com.flagship.member_ledger.fee;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Result of evaluating an event's fees against one registration context.
 */
@Value
public class RegistrationFee {

    /** Total owed, never negative, rounded to cents. */
    BigDecimal amount;

    /** Applied amount per fee definition id, in definition order. */
    Map<Long, BigDecimal> appliedFees;

    /** Applied amounts summed per kind (before clamping the total). */
    Map<FeeKind, BigDecimal> byKind;

    public boolean isActive(Long feeId) {
        return appliedFees.containsKey(feeId);
    }

    public BigDecimal amountOfKind(FeeKind kind) {
        return byKind.getOrDefault(kind, BigDecimal.ZERO.setScale(2));
    }
}
