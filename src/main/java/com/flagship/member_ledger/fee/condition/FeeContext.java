package com.flagship.member_ledger.fee.condition;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * Snapshot of a registration that fee conditions are evaluated against.
 *
 * The context is immutable; a dry run simply builds a context from hypothetical values.
 */
@Value
@Builder(toBuilder = true)
public class FeeContext {

    /** Shortnames of the event parts the registrant is present in (has to pay for). */
    @Singular
    Set<String> presentParts;

    /** Registration field values by field name. Values may be null. */
    @Singular
    Map<String, Object> fields;

    boolean member;
    boolean orga;
    boolean anyPart;
    boolean allParts;

    public boolean isPartPresent(String shortname) {
        return presentParts.contains(shortname);
    }

    /**
     * Truthiness of a field: booleans directly, numbers when non-zero, strings when
     * non-empty, anything else when non-null. A missing field is false.
     */
    public boolean isFieldSet(String name) {
        Object value = fields.get(name);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() != 0;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        return true;
    }

    /**
     * Same registration with a different membership flag.
     */
    public FeeContext withMember(boolean member) {
        return toBuilder().member(member).build();
    }
}
