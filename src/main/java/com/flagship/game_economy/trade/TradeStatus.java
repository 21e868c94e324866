package com.flagship.game_economy.trade;

/**
 * Lifecycle of a trade offer. Only PENDING has outgoing transitions.
 */
public enum TradeStatus {
    PENDING,
    /** Accepted and settled: items and currency have moved. */
    COMPLETED,
    REJECTED,
    /** Withdrawn by the offering competitor. */
    CANCELLED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
