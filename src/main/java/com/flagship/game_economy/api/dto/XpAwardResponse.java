package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.season.RewardType;
import com.flagship.game_economy.season.XpAwardResult;
import lombok.Value;

import java.util.List;

@Value
public class XpAwardResponse {

    @JsonProperty("progression")
    ProgressionResponse progression;

    @JsonProperty("tier_up_rewards")
    List<TierUp> tierUpRewards;

    @Value
    public static class TierUp {
        @JsonProperty("tier_number")
        int tierNumber;

        @JsonProperty("reward_type")
        RewardType rewardType;

        @JsonProperty("reward_amount")
        int rewardAmount;

        @JsonProperty("premium")
        boolean premium;
    }

    public static XpAwardResponse from(XpAwardResult result) {
        return new XpAwardResponse(
            ProgressionResponse.from(result.progression()),
            result.tierUpRewards().stream()
                .map(tier -> new TierUp(tier.tierNumber(), tier.rewardType(), tier.rewardAmount(), tier.premium()))
                .toList());
    }
}
