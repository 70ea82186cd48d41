package com.flagship.member_ledger.fee;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Fee of a registration computed both as member and as non-member.
 *
 * The pair lets the display layer show the non-member surcharge even to members.
 */
@Value
public class RegistrationFeeData {
    RegistrationFee memberFee;
    RegistrationFee nonmemberFee;
    boolean member;

    /** The fee that actually applies to this registrant. */
    public RegistrationFee getFee() {
        return member ? memberFee : nonmemberFee;
    }

    public BigDecimal getAmount() {
        return getFee().getAmount();
    }

    public BigDecimal getNonmemberSurcharge() {
        return nonmemberFee.getAmount().subtract(memberFee.getAmount());
    }

    /** Part of the effective fee that is a donation. */
    public BigDecimal getDonation() {
        BigDecimal donation = BigDecimal.ZERO.setScale(2);
        for (var entry : getFee().getByKind().entrySet()) {
            if (entry.getKey().isDonation()) {
                donation = donation.add(entry.getValue());
            }
        }
        return donation;
    }
}
