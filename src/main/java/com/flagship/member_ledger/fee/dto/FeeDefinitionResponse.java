package com.flagship.member_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.fee.FeeDefinition;
import com.flagship.member_ledger.fee.FeeKind;
import com.flagship.member_ledger.fee.condition.FeeConditionParser;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class FeeDefinitionResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("event_id")
    Long eventId;

    @JsonProperty("title")
    String title;

    @JsonProperty("kind")
    FeeKind kind;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("condition")
    String condition;

    /** Condition in normalized form, as the engine reads it. */
    @JsonProperty("normalized_condition")
    String normalizedCondition;

    @JsonProperty("notes")
    String notes;

    public static FeeDefinitionResponse from(FeeDefinition fee) {
        return FeeDefinitionResponse.builder()
            .id(fee.getId())
            .eventId(fee.getEventId())
            .title(fee.getTitle())
            .kind(fee.getKind())
            .amount(fee.getAmount())
            .condition(fee.getCondition())
            .normalizedCondition(fee.getCondition() == null ? null
                : FeeConditionParser.parse(fee.getCondition()).toConditionString())
            .notes(fee.getNotes())
            .build();
    }
}
