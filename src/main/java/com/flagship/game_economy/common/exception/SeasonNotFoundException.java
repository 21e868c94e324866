package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class SeasonNotFoundException extends EconomyException {

    public SeasonNotFoundException(UUID seasonId) {
        super(ErrorCode.SEASON_NOT_FOUND, "Season not found: " + seasonId);
    }
}
