package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.ledger.Persona;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PersonaResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("given_names")
    String givenNames;

    @JsonProperty("family_name")
    String familyName;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("is_member")
    boolean member;

    @JsonProperty("trial_member")
    boolean trialMember;

    @JsonProperty("is_archived")
    boolean archived;

    public static PersonaResponse from(Persona persona) {
        return PersonaResponse.builder()
            .id(persona.getId())
            .givenNames(persona.getGivenNames())
            .familyName(persona.getFamilyName())
            .balance(persona.getBalance())
            .member(persona.isMember())
            .trialMember(persona.isTrialMember())
            .archived(persona.isArchived())
            .build();
    }
}
