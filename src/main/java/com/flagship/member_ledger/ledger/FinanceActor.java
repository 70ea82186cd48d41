package com.flagship.member_ledger.ledger;

import lombok.Value;

/**
 * Who triggers a ledger operation.
 *
 * Passed explicitly into every mutating call; a scheduled job acts as
 * {@link #system()}, which is logged with a null {@code submitted_by}.
 */
@Value
public class FinanceActor {

    /** Request header carrying the acting persona's id. */
    public static final String HEADER = "X-Persona-Id";

    private static final FinanceActor SYSTEM = new FinanceActor(null);

    Long personaId;

    public static FinanceActor of(Long personaId) {
        return personaId == null ? SYSTEM : new FinanceActor(personaId);
    }

    public static FinanceActor system() {
        return SYSTEM;
    }

    public boolean isSystem() {
        return personaId == null;
    }
}
