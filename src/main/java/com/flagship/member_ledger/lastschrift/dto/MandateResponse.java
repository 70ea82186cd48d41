package com.flagship.member_ledger.lastschrift.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.member_ledger.lastschrift.Mandate;
import com.flagship.member_ledger.lastschrift.MandateReference;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class MandateResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("persona_id")
    Long personaId;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("donation")
    BigDecimal donation;

    @JsonProperty("iban")
    String iban;

    @JsonProperty("account_owner")
    String accountOwner;

    @JsonProperty("account_address")
    String accountAddress;

    @JsonProperty("granted_at")
    Instant grantedAt;

    @JsonProperty("revoked_at")
    Instant revokedAt;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("notes")
    String notes;

    public static MandateResponse from(Mandate mandate, String referencePrefix) {
        return MandateResponse.builder()
            .id(mandate.getId())
            .personaId(mandate.getPersonaId())
            .reference(MandateReference.of(referencePrefix, mandate.getPersonaId(), mandate.getId()))
            .donation(mandate.getDonation())
            .iban(mandate.getIban())
            .accountOwner(mandate.getAccountOwner())
            .accountAddress(mandate.getAccountAddress())
            .grantedAt(mandate.getGrantedAt())
            .revokedAt(mandate.getRevokedAt())
            .active(mandate.isActive())
            .notes(mandate.getNotes())
            .build();
    }
}
