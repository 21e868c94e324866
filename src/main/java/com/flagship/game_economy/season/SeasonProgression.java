package com.flagship.game_economy.season;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A competitor's position on one season's reward track.
 * {@code currentXp} is the XP accumulated towards tier {@code currentTier + 1}.
 */
@Value
public class SeasonProgression {
    UUID id;
    UUID competitorId;
    UUID seasonId;
    int currentTier;
    int currentXp;
    boolean hasBattlePass;
    Instant createdAt;
    Instant updatedAt;

    public boolean hasReached(int tierNumber) {
        return currentTier >= tierNumber;
    }

    public SeasonProgression withPosition(int tier, int xp) {
        return new SeasonProgression(id, competitorId, seasonId, tier, xp, hasBattlePass, createdAt, Instant.now());
    }
}
