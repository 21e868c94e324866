package com.flagship.game_economy.inventory;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * How many of one item a competitor holds. Rows at quantity zero are kept.
 */
@Value
public class InventoryEntry {
    UUID id;
    UUID competitorId;
    UUID itemId;
    int quantity;
    int useCount;
    Instant lastAcquiredAt;
    Instant lastUsedAt;

    public boolean holds(int requested) {
        return quantity >= requested;
    }

    public InventoryKey key() {
        return new InventoryKey(competitorId, itemId);
    }
}
