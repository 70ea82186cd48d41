package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.membership.Period;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class PeriodResponse {

    @JsonProperty("id")
    int id;

    @JsonProperty("balance_state")
    Long balanceState;

    @JsonProperty("balance_done")
    Instant balanceDone;

    @JsonProperty("trial_members")
    int trialMembers;

    @JsonProperty("deducted_members")
    int deductedMembers;

    @JsonProperty("deferred_members")
    int deferredMembers;

    @JsonProperty("lapsed_members")
    int lapsedMembers;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("archival_state")
    Long archivalState;

    @JsonProperty("archival_done")
    Instant archivalDone;

    @JsonProperty("archived_personas")
    int archivedPersonas;

    @JsonProperty("processed")
    Integer processed;

    public static PeriodResponse from(Period period) {
        return from(period, null);
    }

    public static PeriodResponse from(Period period, Integer processed) {
        return PeriodResponse.builder()
            .id(period.getId())
            .balanceState(period.getBalanceState())
            .balanceDone(period.getBalanceDone())
            .trialMembers(period.getBalanceTrialMembers())
            .deductedMembers(period.getBalanceDeductedMembers())
            .deferredMembers(period.getBalanceDeferredMembers())
            .lapsedMembers(period.getBalanceLapsedMembers())
            .total(period.getBalanceTotal())
            .archivalState(period.getArchivalState())
            .archivalDone(period.getArchivalDone())
            .archivedPersonas(period.getArchivalCount())
            .processed(processed)
            .build();
    }
}
