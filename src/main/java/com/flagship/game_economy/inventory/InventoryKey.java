package com.flagship.game_economy.inventory;

import com.flagship.game_economy.common.LockOrdering;

import java.util.Comparator;
import java.util.UUID;

/**
 * Identifies one inventory row.
 */
public record InventoryKey(UUID competitorId, UUID itemId) {

    /**
     * Lock acquisition order for inventory rows: competitor first, then item.
     */
    public static final Comparator<InventoryKey> LOCK_ORDER =
            Comparator.comparing(InventoryKey::competitorId, LockOrdering.ASCENDING)
                    .thenComparing(InventoryKey::itemId, LockOrdering.ASCENDING);
}
