package com.flagship.game_economy.season.event;

import com.flagship.game_economy.common.event.EconomyEvent;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class BattlePassPurchasedEvent implements EconomyEvent {
    public static final String EVENT_TYPE = "BattlePassPurchased";

    UUID eventId;
    UUID progressionId;
    UUID competitorId;
    UUID seasonId;
    long pricePaid;
    Instant occurredAt;

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Season";
    }

    @Override
    public UUID getAggregateId() {
        return progressionId;
    }

    @Override
    public List<UUID> getRecipientIds() {
        return List.of(competitorId);
    }
}
