package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CreatePersonaRequest {

    @NotBlank(message = "Given names are required")
    @JsonProperty("given_names")
    String givenNames;

    @NotBlank(message = "Family name is required")
    @JsonProperty("family_name")
    String familyName;

    @JsonProperty("is_member")
    boolean member;

    @JsonProperty("trial_member")
    boolean trialMember;
}
