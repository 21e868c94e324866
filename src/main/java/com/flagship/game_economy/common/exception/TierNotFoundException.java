package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class TierNotFoundException extends EconomyException {

    public TierNotFoundException(UUID seasonId, int tierNumber) {
        super(ErrorCode.TIER_NOT_FOUND, String.format(
                "Tier %d not found in season %s", tierNumber, seasonId));
    }
}
