package com.flagship.member_ledger.membership;

/**
 * What the semester balance update did to one member.
 */
public enum BillingOutcome {
    /** Trial membership ended, nothing charged. */
    TRIAL_ENDED,
    FEE_DEDUCTED,
    /** Balance too low, but an active mandate will cover the fee. */
    DEFERRED,
    /** Balance too low and no mandate; the balance stays untouched. */
    MEMBERSHIP_LOST,
    /** No longer a member when its turn came. */
    SKIPPED
}
