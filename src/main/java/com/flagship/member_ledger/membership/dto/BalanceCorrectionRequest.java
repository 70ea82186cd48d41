package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceCorrectionRequest {

    @NotNull(message = "New balance is required")
    @DecimalMin(value = "0.00", message = "Balance must not be negative")
    @Digits(integer = 6, fraction = 2, message = "Balance must have at most two fractional digits")
    @JsonProperty("new_balance")
    BigDecimal newBalance;

    @NotBlank(message = "A change note is required")
    @JsonProperty("note")
    String note;
}
