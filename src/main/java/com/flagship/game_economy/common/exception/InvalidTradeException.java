package com.flagship.game_economy.common.exception;

public class InvalidTradeException extends EconomyException {

    public InvalidTradeException(String message) {
        super(ErrorCode.INVALID_TRADE, message);
    }
}
