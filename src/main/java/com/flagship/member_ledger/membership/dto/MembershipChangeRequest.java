package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class MembershipChangeRequest {

    @NotNull(message = "Target membership state is required")
    @JsonProperty("is_member")
    Boolean member;

    @JsonProperty("note")
    String note;
}
