package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.inventory.InventoryEntry;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class InventoryEntryResponse {

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("use_count")
    int useCount;

    @JsonProperty("last_acquired_at")
    Instant lastAcquiredAt;

    @JsonProperty("last_used_at")
    Instant lastUsedAt;

    public static InventoryEntryResponse from(InventoryEntry entry) {
        return new InventoryEntryResponse(entry.getItemId(), entry.getQuantity(), entry.getUseCount(),
                entry.getLastAcquiredAt(), entry.getLastUsedAt());
    }
}
