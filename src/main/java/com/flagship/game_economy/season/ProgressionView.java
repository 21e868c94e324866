package com.flagship.game_economy.season;

import java.util.List;

/**
 * Read model of a progression: where the competitor is, what the next tier costs,
 * and the state of the nearby rewards.
 *
 * @param nextTierXpRequired null at the last tier
 */
public record ProgressionView(SeasonProgression progression,
                              Integer nextTierXpRequired,
                              List<TierRewardStatus> rewards) {

    /**
     * @param available reached, and either free or covered by the battle pass
     */
    public record TierRewardStatus(int tierNumber,
                                   RewardType rewardType,
                                   int rewardAmount,
                                   boolean premium,
                                   boolean claimed,
                                   boolean available) {
    }
}
