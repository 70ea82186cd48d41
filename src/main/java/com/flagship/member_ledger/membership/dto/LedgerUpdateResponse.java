package com.flagship.member_ledger.membership.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.ledger.LedgerUpdate;
import lombok.Value;

/**
 * Persona state after a ledger operation, with the log entry written for it.
 */
@Value
public class LedgerUpdateResponse {

    @JsonProperty("persona")
    PersonaResponse persona;

    @JsonProperty("entry")
    FinanceLogEntryResponse entry;

    public static LedgerUpdateResponse from(LedgerUpdate update) {
        return new LedgerUpdateResponse(
            PersonaResponse.from(update.getAfter()),
            FinanceLogEntryResponse.from(update.getEntry()));
    }
}
