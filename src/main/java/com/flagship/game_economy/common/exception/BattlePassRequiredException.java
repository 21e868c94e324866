package com.flagship.game_economy.common.exception;

public class BattlePassRequiredException extends EconomyException {

    public BattlePassRequiredException(int tierNumber) {
        super(ErrorCode.BATTLE_PASS_REQUIRED,
                "Premium reward for tier " + tierNumber + " requires a battle pass");
    }
}
