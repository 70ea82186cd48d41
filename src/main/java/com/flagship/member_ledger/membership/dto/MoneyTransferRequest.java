package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class MoneyTransferRequest {

    @NotNull(message = "Amount is required")
    @Digits(integer = 6, fraction = 2, message = "Amount must have at most two fractional digits")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("note")
    String note;
}
