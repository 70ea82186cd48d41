package com.flagship.member_ledger.lastschrift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class RevokeMandateRequest {

    @JsonProperty("reason")
    String reason;
}
