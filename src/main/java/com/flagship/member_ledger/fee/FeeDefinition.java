package com.flagship.member_ledger.fee;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A conditional charge or discount attached to an event.
 *
 * Amounts are signed (discounts are negative) and carry exactly two fractional digits.
 * The condition is kept as entered; {@code null} means the fee always applies.
 */
@Value
public class FeeDefinition {
    Long id;
    Long eventId;
    String title;
    FeeKind kind;
    BigDecimal amount;
    String condition;
    String notes;

    /**
     * Creates a new, not yet persisted fee definition.
     *
     * @throws IllegalArgumentException if the title is blank or the amount has more than
     *                                  two fractional digits
     */
    public static FeeDefinition create(Long eventId, String title, FeeKind kind,
                                       BigDecimal amount, String condition, String notes) {
        return new FeeDefinition(null, eventId, requireTitle(title), requireKind(kind),
                normalizeAmount(amount), normalizeCondition(condition), notes);
    }

    /**
     * Returns a copy with new administrative values. Id and event stay fixed.
     */
    public FeeDefinition update(String title, FeeKind kind, BigDecimal amount, String condition, String notes) {
        return new FeeDefinition(this.id, this.eventId, requireTitle(title), requireKind(kind),
                normalizeAmount(amount), normalizeCondition(condition), notes);
    }

    static BigDecimal normalizeAmount(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Fee amount is required");
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new IllegalArgumentException(
                    "Fee amount must have at most two fractional digits: " + amount.toPlainString());
        }
        return amount.setScale(2, RoundingMode.UNNECESSARY);
    }

    private static String normalizeCondition(String condition) {
        if (condition == null || condition.isBlank()) {
            return null;
        }
        return condition.trim();
    }

    private static String requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Fee title is required");
        }
        return title.trim();
    }

    private static FeeKind requireKind(FeeKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Fee kind is required");
        }
        return kind;
    }
}
