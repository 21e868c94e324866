package com.flagship.game_economy.common.exception;

public class RequirementNotMetException extends EconomyException {

    public RequirementNotMetException(String description) {
        super(ErrorCode.REQUIREMENT_NOT_MET, "Purchase requirement not met: " + description);
    }
}
