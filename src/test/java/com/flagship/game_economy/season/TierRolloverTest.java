package com.flagship.game_economy.season;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tier rollover arithmetic against a three-tier track of 100, 150 and 200 XP.
 */
class TierRolloverTest {

    private static final List<SeasonTier> TIERS = List.of(
        new SeasonTier(1, 100, RewardType.CURRENCY, 50, null, false),
        new SeasonTier(2, 150, RewardType.CURRENCY, 100, null, false),
        new SeasonTier(3, 200, RewardType.ITEM, 1, UUID.randomUUID(), true)
    );

    @Test
    @DisplayName("300 XP from the start crosses two tiers and keeps 50 XP")
    void testMultipleTierUps() {
        TierRollover.Result result = TierRollover.apply(0, 0, 300, TIERS);

        assertEquals(2, result.tier());
        assertEquals(50, result.xp());
        assertEquals(List.of(1, 2), result.tiersReached().stream().map(SeasonTier::tierNumber).toList());
        assertTrue(result.tieredUp());
    }

    @Test
    @DisplayName("XP below the next threshold accumulates without a tier-up")
    void testAccumulatesBelowThreshold() {
        TierRollover.Result result = TierRollover.apply(1, 20, 100, TIERS);

        assertEquals(1, result.tier());
        assertEquals(120, result.xp());
        assertFalse(result.tieredUp());
    }

    @Test
    @DisplayName("Reaching a threshold exactly tiers up with zero XP left")
    void testExactThreshold() {
        TierRollover.Result result = TierRollover.apply(0, 40, 60, TIERS);

        assertEquals(1, result.tier());
        assertEquals(0, result.xp());
        assertEquals(1, result.tiersReached().size());
    }

    @Test
    @DisplayName("XP beyond the last tier is dropped")
    void testClampsAtLastTier() {
        TierRollover.Result result = TierRollover.apply(0, 0, 10_000, TIERS);

        assertEquals(3, result.tier());
        assertEquals(0, result.xp());
        assertEquals(3, result.tiersReached().size());
    }

    @Test
    @DisplayName("A competitor already at the last tier stays there with 0 XP")
    void testAlreadyAtLastTier() {
        TierRollover.Result result = TierRollover.apply(3, 0, 500, TIERS);

        assertEquals(3, result.tier());
        assertEquals(0, result.xp());
        assertFalse(result.tieredUp());
    }

    @Test
    @DisplayName("A season without tiers never moves")
    void testEmptyCatalog() {
        TierRollover.Result result = TierRollover.apply(0, 0, 300, List.of());

        assertEquals(0, result.tier());
        assertEquals(0, result.xp());
        assertFalse(result.tieredUp());
    }

    @Test
    @DisplayName("Negative XP is rejected")
    void testNegativeAmount() {
        assertThrows(IllegalArgumentException.class, () -> TierRollover.apply(0, 0, -1, TIERS));
    }
}
