package com.flagship.game_economy.season;

import java.time.Instant;
import java.util.UUID;

public record ClaimedReward(UUID id,
                            UUID competitorId,
                            UUID seasonId,
                            int tierNumber,
                            RewardType rewardType,
                            int rewardAmount,
                            UUID rewardItemId,
                            Instant claimedAt) {
}
