package com.flagship.game_economy.common.exception;

public class TierNotReachedException extends EconomyException {

    public TierNotReachedException(int tierNumber, int currentTier) {
        super(ErrorCode.TIER_NOT_REACHED, String.format(
                "Tier %d not reached (current tier %d)", tierNumber, currentTier));
    }
}
