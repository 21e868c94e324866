package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class RecipientNotFoundException extends EconomyException {

    public RecipientNotFoundException(UUID competitorId) {
        super(ErrorCode.RECIPIENT_NOT_FOUND, "Recipient not found: " + competitorId);
    }
}
