package com.flagship.game_economy.common.exception;

public class InvalidRequestException extends EconomyException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }
}
