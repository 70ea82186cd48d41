package com.flagship.member_ledger.lastschrift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.lastschrift.TransactionOutcome;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;

@Value
public class FinalizeTransactionsRequest {

    @NotEmpty(message = "At least one transaction is required")
    @JsonProperty("transaction_ids")
    List<Long> transactionIds;

    @NotNull(message = "Outcome is required")
    @JsonProperty("outcome")
    TransactionOutcome outcome;
}
