package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.ledger.FinanceLogEntry;
import com.flagship.member_ledger.ledger.Persona;
import com.flagship.member_ledger.membership.MoneyTransferResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class MoneyTransferResponse {

    @JsonProperty("finance_log_id")
    Long financeLogId;

    @JsonProperty("persona_id")
    Long personaId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("new_balance")
    BigDecimal newBalance;

    @JsonProperty("membership_gained")
    boolean membershipGained;

    @JsonProperty("trial_ended")
    boolean trialEnded;

    @JsonProperty("persona")
    PersonaResponse persona;

    public static MoneyTransferResponse from(MoneyTransferResult result) {
        FinanceLogEntry entry = result.getTransfer().getEntry();
        return MoneyTransferResponse.builder()
            .financeLogId(entry.getId())
            .personaId(entry.getPersonaId())
            .amount(entry.getDelta())
            .newBalance(entry.getNewBalance())
            .membershipGained(result.isMembershipGained())
            .trialEnded(result.isTrialEnded())
            .persona(PersonaResponse.from(result.getPersona()))
            .build();
    }

    /**
     * Replay of an earlier request; membership flags show the current state.
     */
    public static MoneyTransferResponse replay(FinanceLogEntry entry, Persona persona) {
        return MoneyTransferResponse.builder()
            .financeLogId(entry.getId())
            .personaId(entry.getPersonaId())
            .amount(entry.getDelta())
            .newBalance(entry.getNewBalance())
            .persona(PersonaResponse.from(persona))
            .build();
    }
}
