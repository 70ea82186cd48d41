package com.flagship.member_ledger.fee.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Payment received for an event registration. Negative amounts are refunds.
 */
@Value
public class RegistrationPaymentRequest {

    @NotNull(message = "Amount is required")
    @Digits(integer = 9, fraction = 2, message = "Amount must have at most two fractional digits")
    @JsonProperty("amount")
    BigDecimal amount;
}
