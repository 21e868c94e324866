package com.flagship.game_economy.season;

import java.util.UUID;

/**
 * One step of a season's reward track. {@code xpRequired} is the XP needed to go from
 * the previous tier to this one.
 */
public record SeasonTier(int tierNumber,
                         int xpRequired,
                         RewardType rewardType,
                         int rewardAmount,
                         UUID rewardItemId,
                         boolean premium) {
}
