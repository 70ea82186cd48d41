package com.flagship.member_ledger.fee;

import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Per-kind fee totals of an event.
 *
 * {@code owed} sums the applied fees of every registration. {@code paid} only counts
 * registrations that have paid at least what they owe, so over-payments never inflate a
 * kind and partial payments are not attributed to any kind.
 */
@Value
public class FeeStats {
    Long eventId;
    Map<FeeKind, BigDecimal> owed;
    Map<FeeKind, BigDecimal> paid;
}
