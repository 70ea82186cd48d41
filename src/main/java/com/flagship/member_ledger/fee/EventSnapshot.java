package com.flagship.member_ledger.fee;

import lombok.Value;

import java.util.Collection;
import java.util.Set;

/**
 * The parts of an event the fee engine needs: its part shortnames, registration field
 * names, orga team and lock state. Owned by the event subsystem; read only here.
 */
@Value
public class EventSnapshot {
    Long id;
    String title;
    boolean locked;
    boolean archived;
    Set<String> partShortnames;
    Set<String> fieldNames;
    Set<Long> orgaIds;

    /**
     * Fee definitions of a locked or archived event are frozen.
     */
    public boolean isFeeChangeAllowed() {
        return !locked && !archived;
    }

    public boolean isOrga(Long personaId) {
        return orgaIds.contains(personaId);
    }

    public boolean coversAllParts(Collection<String> presentParts) {
        return presentParts.containsAll(partShortnames);
    }
}
