package com.flagship.member_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.fee.FeeKind;
import com.flagship.member_ledger.fee.RegistrationFeeData;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class RegistrationFeeResponse {

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("member_fee")
    BigDecimal memberFee;

    @JsonProperty("nonmember_fee")
    BigDecimal nonmemberFee;

    @JsonProperty("nonmember_surcharge")
    BigDecimal nonmemberSurcharge;

    @JsonProperty("donation")
    BigDecimal donation;

    @JsonProperty("active_fees")
    Set<Long> activeFees;

    @JsonProperty("by_kind")
    Map<FeeKind, BigDecimal> byKind;

    public static RegistrationFeeResponse from(RegistrationFeeData data) {
        return RegistrationFeeResponse.builder()
            .amount(data.getAmount())
            .memberFee(data.getMemberFee().getAmount())
            .nonmemberFee(data.getNonmemberFee().getAmount())
            .nonmemberSurcharge(data.getNonmemberSurcharge())
            .donation(data.getDonation())
            .activeFees(data.getFee().getAppliedFees().keySet())
            .byKind(data.getFee().getByKind())
            .build();
    }
}
