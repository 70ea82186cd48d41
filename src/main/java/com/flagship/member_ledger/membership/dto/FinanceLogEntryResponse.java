package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.FinanceLogEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Value
@Builder
public class FinanceLogEntryResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("ctime")
    Instant ctime;

    @JsonProperty("code")
    FinanceLogCode code;

    @JsonProperty("submitted_by")
    Long submittedBy;

    @JsonProperty("persona_id")
    Long personaId;

    @JsonProperty("delta")
    BigDecimal delta;

    @JsonProperty("new_balance")
    BigDecimal newBalance;

    @JsonProperty("transaction_date")
    LocalDate transactionDate;

    @JsonProperty("change_note")
    String changeNote;

    @JsonProperty("members")
    int members;

    @JsonProperty("total")
    BigDecimal total;

    @JsonProperty("member_total")
    BigDecimal memberTotal;

    public static FinanceLogEntryResponse from(FinanceLogEntry entry) {
        return FinanceLogEntryResponse.builder()
            .id(entry.getId())
            .ctime(entry.getCtime())
            .code(entry.getCode())
            .submittedBy(entry.getSubmittedBy())
            .personaId(entry.getPersonaId())
            .delta(entry.getDelta())
            .newBalance(entry.getNewBalance())
            .transactionDate(entry.getTransactionDate())
            .changeNote(entry.getChangeNote())
            .members(entry.getMembers())
            .total(entry.getTotal())
            .memberTotal(entry.getMemberTotal())
            .build();
    }
}
