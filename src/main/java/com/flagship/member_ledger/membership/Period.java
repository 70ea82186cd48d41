package com.flagship.member_ledger.membership;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A billing period (semester) and the progress of its balance update and of the
 * automatic archival that follows it.
 *
 * Both walk the personas in id order; {@code balanceState} and {@code archivalState}
 * are the id of the last persona handled, so an interrupted run resumes where it
 * stopped.
 */
@Value
public class Period {
    int id;
    Long balanceState;
    Instant balanceDone;
    int balanceTrialMembers;
    int balanceDeductedMembers;
    int balanceDeferredMembers;
    int balanceLapsedMembers;
    BigDecimal balanceTotal;
    Long archivalState;
    Instant archivalDone;
    int archivalCount;

    public boolean isBalanceDone() {
        return balanceDone != null;
    }

    public boolean isBalanceStarted() {
        return balanceState != null || isBalanceDone();
    }

    public boolean isArchivalDone() {
        return archivalDone != null;
    }

    public boolean isArchivalStarted() {
        return archivalState != null || isArchivalDone();
    }

    /**
     * Progress after handling one persona. {@code deducted} is the fee charged, if any.
     */
    public Period afterStep(Long personaId, BillingOutcome outcome, BigDecimal deducted) {
        return new Period(
            id,
            personaId,
            balanceDone,
            balanceTrialMembers + (outcome == BillingOutcome.TRIAL_ENDED ? 1 : 0),
            balanceDeductedMembers + (outcome == BillingOutcome.FEE_DEDUCTED ? 1 : 0),
            balanceDeferredMembers + (outcome == BillingOutcome.DEFERRED ? 1 : 0),
            balanceLapsedMembers + (outcome == BillingOutcome.MEMBERSHIP_LOST ? 1 : 0),
            deducted != null ? balanceTotal.add(deducted) : balanceTotal,
            archivalState,
            archivalDone,
            archivalCount
        );
    }

    public Period afterArchivalStep(Long personaId, boolean archived) {
        return new Period(id, balanceState, balanceDone, balanceTrialMembers, balanceDeductedMembers,
            balanceDeferredMembers, balanceLapsedMembers, balanceTotal,
            personaId, archivalDone, archivalCount + (archived ? 1 : 0));
    }
}
