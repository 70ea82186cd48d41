package com.flagship.member_ledger.event;

import com.flagship.member_ledger.lastschrift.Mandate;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class MandateRevokedEvent implements FinanceEvent {
    UUID eventId;
    Long mandateId;
    Long personaId;
    String reason;
    Instant revokedAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MandateRevoked";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return Mandate.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return mandateId.toString();
    }

    public static MandateRevokedEvent from(Mandate mandate, String reason) {
        return new MandateRevokedEvent(
            UUID.randomUUID(),
            mandate.getId(),
            mandate.getPersonaId(),
            reason,
            mandate.getRevokedAt(),
            Instant.now()
        );
    }
}
