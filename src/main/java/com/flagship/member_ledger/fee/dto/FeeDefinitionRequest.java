package com.flagship.member_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.fee.FeeKind;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Administrative form for creating or replacing a fee definition.
 */
@Value
public class FeeDefinitionRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title must be at most 200 characters")
    @JsonProperty("title")
    String title;

    @NotNull(message = "Kind is required")
    @JsonProperty("kind")
    FeeKind kind;

    @NotNull(message = "Amount is required")
    @Digits(integer = 6, fraction = 2, message = "Amount must have at most two fractional digits")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("condition")
    String condition;

    @JsonProperty("notes")
    String notes;
}
