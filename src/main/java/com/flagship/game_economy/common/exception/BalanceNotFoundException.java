package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class BalanceNotFoundException extends EconomyException {

    public BalanceNotFoundException(UUID competitorId) {
        super(ErrorCode.BALANCE_NOT_FOUND, "Currency balance not found for competitor: " + competitorId);
    }
}
