package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.membership.MoneyTransfer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Parsed bank statement: booked all or nothing.
 */
@Value
public class MoneyTransferBatchRequest {

    @NotEmpty(message = "At least one transfer is required")
    @Valid
    @JsonProperty("transfers")
    List<Line> transfers;

    public List<MoneyTransfer> toTransfers() {
        return transfers.stream()
            .map(line -> new MoneyTransfer(line.getPersonaId(), line.getAmount(),
                line.getTransactionDate(), line.getNote()))
            .toList();
    }

    @Value
    public static class Line {

        @NotNull(message = "Persona is required")
        @JsonProperty("persona_id")
        Long personaId;

        @NotNull(message = "Amount is required")
        @Digits(integer = 6, fraction = 2, message = "Amount must have at most two fractional digits")
        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("transaction_date")
        LocalDate transactionDate;

        @JsonProperty("note")
        String note;
    }
}
