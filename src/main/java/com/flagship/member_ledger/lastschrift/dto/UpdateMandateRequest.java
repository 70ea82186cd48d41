package com.flagship.member_ledger.lastschrift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Replaces donation, account holder and notes of a mandate. The IBAN cannot change.
 */
@Value
public class UpdateMandateRequest {

    @NotNull(message = "Donation is required")
    @DecimalMin(value = "0.00", message = "Donation must not be negative")
    @Digits(integer = 6, fraction = 2, message = "Donation must have at most two fractional digits")
    @JsonProperty("donation")
    BigDecimal donation;

    @Size(max = 70, message = "Account owner must not exceed 70 characters")
    @JsonProperty("account_owner")
    String accountOwner;

    @JsonProperty("account_address")
    String accountAddress;

    @JsonProperty("notes")
    String notes;
}
