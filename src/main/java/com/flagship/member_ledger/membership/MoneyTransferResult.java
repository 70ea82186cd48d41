package com.flagship.member_ledger.membership;

import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.LedgerUpdate;
import com.flagship.member_ledger.ledger.Persona;
import lombok.Value;

/**
 * Balance change of a money transfer and the membership change it triggered, if any.
 */
@Value
public class MoneyTransferResult {
    LedgerUpdate transfer;
    LedgerUpdate membershipChange;

    public Persona getPersona() {
        return membershipChange != null ? membershipChange.getAfter() : transfer.getAfter();
    }

    public boolean isMembershipGained() {
        return membershipChange != null
            && membershipChange.getEntry().getCode() == FinanceLogCode.GAIN_MEMBERSHIP;
    }

    public boolean isTrialEnded() {
        return membershipChange != null
            && membershipChange.getEntry().getCode() == FinanceLogCode.END_TRIAL_MEMBERSHIP;
    }
}
