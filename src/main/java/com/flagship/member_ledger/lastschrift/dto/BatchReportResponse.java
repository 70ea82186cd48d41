package com.flagship.member_ledger.lastschrift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.lastschrift.BatchItemError;
import com.flagship.member_ledger.lastschrift.BatchReport;
import com.flagship.member_ledger.lastschrift.LastschriftTransaction;
import lombok.Value;

import java.util.List;

@Value
public class BatchReportResponse {

    @JsonProperty("processed")
    List<TransactionResponse> processed;

    @JsonProperty("errors")
    List<ItemError> errors;

    public static BatchReportResponse from(BatchReport<LastschriftTransaction> report) {
        return new BatchReportResponse(
            report.getProcessed().stream().map(TransactionResponse::from).toList(),
            report.getErrors().stream().map(ItemError::from).toList()
        );
    }

    @Value
    public static class ItemError {

        @JsonProperty("item_id")
        Long itemId;

        @JsonProperty("code")
        BatchItemError.Code code;

        @JsonProperty("message")
        String message;

        public static ItemError from(BatchItemError error) {
            return new ItemError(error.getItemId(), error.getCode(), error.getMessage());
        }
    }
}
