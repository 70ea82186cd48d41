package com.flagship.member_ledger.lastschrift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.lastschrift.LastschriftTransaction;
import com.flagship.member_ledger.lastschrift.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("mandate_id")
    Long mandateId;

    @JsonProperty("period_id")
    Integer periodId;

    @JsonProperty("status")
    TransactionStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("tally")
    BigDecimal tally;

    @JsonProperty("issued_at")
    Instant issuedAt;

    @JsonProperty("payment_date")
    LocalDate paymentDate;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static TransactionResponse from(LastschriftTransaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .mandateId(transaction.getMandateId())
            .periodId(transaction.getPeriodId())
            .status(transaction.getStatus())
            .amount(transaction.getAmount())
            .tally(transaction.getTally())
            .issuedAt(transaction.getIssuedAt())
            .paymentDate(transaction.getPaymentDate())
            .processedAt(transaction.getProcessedAt())
            .build();
    }
}
