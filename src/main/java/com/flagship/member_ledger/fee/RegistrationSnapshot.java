package com.flagship.member_ledger.fee;

import com.flagship.member_ledger.fee.condition.FeeContext;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read model of a registration: part states, field values and the payment columns this
 * service maintains.
 */
@Value
public class RegistrationSnapshot {
    Long id;
    Long eventId;
    Long personaId;
    boolean member;
    Map<String, RegistrationPartStatus> partStatuses;
    Map<String, Object> fields;
    BigDecimal amountOwed;
    BigDecimal amountPaid;

    public Set<String> getPresentParts() {
        return partStatuses.entrySet().stream()
            .filter(entry -> entry.getValue().hasToPay())
            .map(Map.Entry::getKey)
            .collect(Collectors.toSet());
    }

    public boolean isFullyPaid() {
        return amountPaid.compareTo(amountOwed) >= 0;
    }

    /**
     * Builds the evaluation context for this registration within its event.
     */
    public FeeContext toFeeContext(EventSnapshot event) {
        Set<String> present = getPresentParts();
        return FeeContext.builder()
            .presentParts(present)
            .fields(fields)
            .member(member)
            .orga(event.isOrga(personaId))
            .anyPart(!present.isEmpty())
            .allParts(event.coversAllParts(present))
            .build();
    }
}
