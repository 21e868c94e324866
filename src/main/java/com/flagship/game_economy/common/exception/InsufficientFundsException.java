package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class InsufficientFundsException extends EconomyException {

    private final UUID competitorId;
    private final long requested;
    private final long available;

    public InsufficientFundsException(UUID competitorId, long requested, long available) {
        super(ErrorCode.INSUFFICIENT_FUNDS, String.format(
                "Insufficient funds for competitor %s: requested=%d, available=%d",
                competitorId, requested, available));
        this.competitorId = competitorId;
        this.requested = requested;
        this.available = available;
    }

    public UUID getCompetitorId() {
        return competitorId;
    }

    public long getRequested() {
        return requested;
    }

    public long getAvailable() {
        return available;
    }
}
