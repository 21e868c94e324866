package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class AlreadyPurchasedException extends EconomyException {

    public AlreadyPurchasedException(UUID competitorId, UUID seasonId) {
        super(ErrorCode.ALREADY_PURCHASED, String.format(
                "Battle pass already purchased by competitor %s for season %s", competitorId, seasonId));
    }
}
