package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.season.ClaimedReward;
import com.flagship.game_economy.season.RewardType;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class ClaimedRewardResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("tier_number")
    int tierNumber;

    @JsonProperty("reward_type")
    RewardType rewardType;

    @JsonProperty("reward_amount")
    int rewardAmount;

    @JsonProperty("reward_item_id")
    UUID rewardItemId;

    @JsonProperty("claimed_at")
    Instant claimedAt;

    public static ClaimedRewardResponse from(ClaimedReward reward) {
        return new ClaimedRewardResponse(reward.id(), reward.tierNumber(), reward.rewardType(),
                reward.rewardAmount(), reward.rewardItemId(), reward.claimedAt());
    }
}
