package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class TradeNotFoundException extends EconomyException {

    public TradeNotFoundException(UUID tradeId) {
        super(ErrorCode.TRADE_NOT_FOUND, "Trade not found: " + tradeId);
    }
}
