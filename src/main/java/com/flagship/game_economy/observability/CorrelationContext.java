package com.flagship.game_economy.observability;

import java.util.UUID;

/**
 * MDC keys and correlation ids shared by the request filter, the event consumer and the services.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String COMPETITOR_ID_MDC_KEY = "competitorId";
    public static final String TRADE_ID_MDC_KEY = "tradeId";

    static final int MAX_INBOUND_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * The caller's id when it is fit for a log line, otherwise a fresh one.
     */
    public static String resolve(String inbound) {
        if (inbound == null || inbound.isBlank() || inbound.length() > MAX_INBOUND_LENGTH) {
            return newCorrelationId();
        }
        return inbound.trim();
    }

    public static String newCorrelationId() {
        return shortForm(UUID.randomUUID());
    }

    /**
     * Consumed events are correlated by their event id, so a fan-out can be traced back to its outbox row.
     */
    public static String forEvent(UUID eventId) {
        return shortForm(eventId);
    }

    private static String shortForm(UUID id) {
        return id.toString().substring(0, 8);
    }
}
