package com.flagship.game_economy.season;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Applies an XP award to a position on a reward track.
 *
 * Each crossed tier consumes its {@code xpRequired}. Once there is no next tier the
 * remaining XP is dropped to zero, so a competitor at the last tier always shows 0 XP.
 * The loop runs at most once per catalog tier.
 */
public final class TierRollover {

    private TierRollover() {
    }

    public record Result(int tier, int xp, List<SeasonTier> tiersReached) {

        public boolean tieredUp() {
            return !tiersReached.isEmpty();
        }
    }

    public static Result apply(int currentTier, int currentXp, int amount, List<SeasonTier> tiers) {
        if (amount < 0) {
            throw new IllegalArgumentException("XP amount cannot be negative");
        }
        Map<Integer, SeasonTier> byNumber = tiers.stream()
                .collect(Collectors.toMap(SeasonTier::tierNumber, Function.identity()));

        long xp = (long) currentXp + amount;
        int tier = currentTier;
        List<SeasonTier> reached = new ArrayList<>();

        for (int step = 0; step <= tiers.size(); step++) {
            SeasonTier next = byNumber.get(tier + 1);
            if (next == null) {
                xp = 0;
                break;
            }
            if (xp < next.xpRequired()) {
                break;
            }
            xp -= next.xpRequired();
            tier = next.tierNumber();
            reached.add(next);
        }

        return new Result(tier, (int) xp, Collections.unmodifiableList(reached));
    }
}
