package com.flagship.game_economy.season.event;

import com.flagship.game_economy.common.event.EconomyEvent;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An XP award moved a competitor up one or more tiers.
 */
@Value
public class SeasonTierUpEvent implements EconomyEvent {
    public static final String EVENT_TYPE = "SeasonTierUp";

    UUID eventId;
    UUID progressionId;
    UUID competitorId;
    UUID seasonId;
    int tierBefore;
    int tierAfter;
    List<Integer> tiersReached;
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
