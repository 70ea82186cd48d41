package com.flagship.member_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Set;

/**
 * Finance log query. Null or empty criteria match everything; dates are inclusive and
 * compare against the entry's creation day.
 */
@Value
@Builder
public class FinanceLogFilter {
    Set<FinanceLogCode> codes;
    Long personaId;
    LocalDate from;
    LocalDate to;
    @Builder.Default
    int offset = 0;
    @Builder.Default
    int limit = 50;
}
