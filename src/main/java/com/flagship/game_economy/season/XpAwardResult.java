package com.flagship.game_economy.season;

import java.util.List;

/**
 * Outcome of an XP award: the updated progression and every tier crossed, in order.
 */
public record XpAwardResult(SeasonProgression progression, List<SeasonTier> tierUpRewards) {

    public boolean tieredUp() {
        return !tierUpRewards.isEmpty();
    }
}
