package com.flagship.member_ledger.observability;

import java.util.UUID;

/**
 * Correlation id header and the MDC keys used across the service.
 *
 * The id comes from the X-Correlation-ID request header or is generated, and ends up
 * in every log line of the request via MDC. Ledger calls add the booked persona and
 * direct debit batch items add the transaction id, so a finance log entry can be
 * traced back to the request that wrote it.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSACTION_ID_MDC_KEY = "transactionId";
    public static final String PERSONA_ID_MDC_KEY = "personaId";
    /** Persona that triggered the request (X-Persona-Id), as opposed to the one booked. */
    public static final String ACTOR_ID_MDC_KEY = "actorId";

    private CorrelationContext() {
    }

    // short form, easier to grep in logs
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
