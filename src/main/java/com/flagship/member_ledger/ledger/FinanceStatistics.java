package com.flagship.member_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Snapshot of the membership finances, as shown on the finance overview.
 *
 * "Low balance" means the balance does not cover the next membership fee.
 */
@Value
public class FinanceStatistics {
    long members;
    long trialMembers;
    BigDecimal memberTotal;
    long lowBalanceMembers;
    BigDecimal lowBalanceTotal;
    long lowBalanceMembersWithMandate;
}
