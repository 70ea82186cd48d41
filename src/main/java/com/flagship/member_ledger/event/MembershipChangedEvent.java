package com.flagship.member_ledger.event;

import com.flagship.member_ledger.ledger.FinanceLogCode;
import com.flagship.member_ledger.ledger.LedgerUpdate;
import com.flagship.member_ledger.ledger.Persona;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A persona gained or lost membership, or started or ended a trial membership.
 */
@Value
public class MembershipChangedEvent implements FinanceEvent {
    UUID eventId;
    Long personaId;
    FinanceLogCode code;
    boolean member;
    boolean trialMember;
    BigDecimal balance;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MembershipChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return Persona.AGGREGATE_TYPE;
    }

    @Override
    public String getAggregateId() {
        return personaId.toString();
    }

    public static MembershipChangedEvent from(LedgerUpdate update) {
        Persona after = update.getAfter();
        return new MembershipChangedEvent(
            UUID.randomUUID(),
            after.getId(),
            update.getEntry().getCode(),
            after.isMember(),
            after.isTrialMember(),
            after.getBalance(),
            Instant.now()
        );
    }
}
