package com.flagship.member_ledger.membership;

import lombok.Value;

@Value
public class BalanceUpdateReport {
    /** Personas handled by this run (earlier, interrupted runs not included). */
    int processed;
    Period period;
}
