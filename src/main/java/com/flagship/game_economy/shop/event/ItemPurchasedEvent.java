package com.flagship.game_economy.shop.event;

import com.flagship.game_economy.common.event.EconomyEvent;
import com.flagship.game_economy.shop.PurchaseReceipt;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class ItemPurchasedEvent implements EconomyEvent {
    public static final String EVENT_TYPE = "ItemPurchased";

    UUID eventId;
    UUID purchaseId;
    UUID competitorId;
    UUID itemId;
    int quantity;
    long totalPrice;
    Instant occurredAt;

    public static ItemPurchasedEvent fromReceipt(PurchaseReceipt receipt) {
        return new ItemPurchasedEvent(
            UUID.randomUUID(),
            receipt.purchaseId(),
            receipt.competitorId(),
            receipt.itemId(),
            receipt.quantity(),
            receipt.totalPrice(),
            Instant.now()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Shop";
    }

    @Override
    public UUID getAggregateId() {
        return purchaseId;
    }

    @Override
    public List<UUID> getRecipientIds() {
        return List.of(competitorId);
    }
}
