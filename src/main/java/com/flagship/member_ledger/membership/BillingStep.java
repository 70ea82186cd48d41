package com.flagship.member_ledger.membership;

import lombok.Value;

@Value
public class BillingStep {
    Long personaId;
    BillingOutcome outcome;
    Period period;
}
