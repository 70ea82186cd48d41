package com.flagship.member_ledger.lastschrift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

/**
 * Without mandate ids every mandate open for debit is used.
 */
@Value
public class GenerateTransactionsRequest {

    @JsonProperty("mandate_ids")
    List<Long> mandateIds;
}
