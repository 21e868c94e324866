package com.flagship.game_economy.season.event;

import com.flagship.game_economy.common.event.EconomyEvent;
import com.flagship.game_economy.season.ClaimedReward;
import com.flagship.game_economy.season.RewardType;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class SeasonRewardClaimedEvent implements EconomyEvent {
    public static final String EVENT_TYPE = "SeasonRewardClaimed";

    UUID eventId;
    UUID progressionId;
    UUID competitorId;
    UUID seasonId;
    int tierNumber;
    RewardType rewardType;
    int rewardAmount;
    Instant occurredAt;

    public static SeasonRewardClaimedEvent of(UUID progressionId, ClaimedReward reward) {
        return new SeasonRewardClaimedEvent(
            UUID.randomUUID(),
            progressionId,
            reward.competitorId(),
            reward.seasonId(),
            reward.tierNumber(),
            reward.rewardType(),
            reward.rewardAmount(),
            Instant.now()
        );
    }

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
