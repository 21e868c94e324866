package com.flagship.game_economy.season;

/**
 * What a season tier pays out when claimed.
 */
public enum RewardType {
    CURRENCY,
    PREMIUM_CURRENCY,
    ITEM;

    public boolean isCurrency() {
        return this == CURRENCY || this == PREMIUM_CURRENCY;
    }
}
