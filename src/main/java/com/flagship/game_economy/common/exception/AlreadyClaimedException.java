package com.flagship.game_economy.common.exception;

public class AlreadyClaimedException extends EconomyException {

    public AlreadyClaimedException(String message) {
        super(ErrorCode.ALREADY_CLAIMED, message);
    }
}
