package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.season.ProgressionView;
import com.flagship.game_economy.season.RewardType;
import com.flagship.game_economy.season.SeasonProgression;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ProgressionResponse {

    @JsonProperty("progression_id")
    UUID progressionId;

    @JsonProperty("competitor_id")
    UUID competitorId;

    @JsonProperty("season_id")
    UUID seasonId;

    @JsonProperty("current_tier")
    int currentTier;

    @JsonProperty("current_xp")
    int currentXp;

    @JsonProperty("has_battle_pass")
    boolean hasBattlePass;

    @JsonProperty("next_tier_xp_required")
    Integer nextTierXpRequired;

    @JsonProperty("rewards")
    List<TierReward> rewards;

    @Value
    public static class TierReward {
        @JsonProperty("tier_number")
        int tierNumber;

        @JsonProperty("reward_type")
        RewardType rewardType;

        @JsonProperty("reward_amount")
        int rewardAmount;

        @JsonProperty("premium")
        boolean premium;

        @JsonProperty("claimed")
        boolean claimed;

        @JsonProperty("available")
        boolean available;
    }

    public static ProgressionResponse from(SeasonProgression progression) {
        return base(progression).rewards(List.of()).build();
    }

    public static ProgressionResponse from(ProgressionView view) {
        return base(view.progression())
            .nextTierXpRequired(view.nextTierXpRequired())
            .rewards(view.rewards().stream()
                .map(r -> new TierReward(r.tierNumber(), r.rewardType(), r.rewardAmount(),
                        r.premium(), r.claimed(), r.available()))
                .toList())
            .build();
    }

    private static ProgressionResponseBuilder base(SeasonProgression progression) {
        return ProgressionResponse.builder()
            .progressionId(progression.getId())
            .competitorId(progression.getCompetitorId())
            .seasonId(progression.getSeasonId())
            .currentTier(progression.getCurrentTier())
            .currentXp(progression.getCurrentXp())
            .hasBattlePass(progression.isHasBattlePass());
    }
}
