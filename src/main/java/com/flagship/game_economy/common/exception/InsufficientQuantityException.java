package com.flagship.game_economy.common.exception;

import java.util.UUID;

/**
 * Raised when a competitor holds fewer units of an item than an operation needs.
 * Names the first under-supplied item only.
 */
public class InsufficientQuantityException extends EconomyException {

    private final UUID competitorId;
    private final UUID itemId;
    private final int requested;
    private final int available;

    public InsufficientQuantityException(UUID competitorId, UUID itemId, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_QUANTITY, String.format(
                "Insufficient quantity of item %s for competitor %s: requested=%d, available=%d",
                itemId, competitorId, requested, available));
        this.competitorId = competitorId;
        this.itemId = itemId;
        this.requested = requested;
        this.available = available;
    }

    public UUID getCompetitorId() {
        return competitorId;
    }

    public UUID getItemId() {
        return itemId;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
