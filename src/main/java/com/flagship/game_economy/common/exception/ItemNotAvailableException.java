package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class ItemNotAvailableException extends EconomyException {

    public ItemNotAvailableException(UUID itemId) {
        super(ErrorCode.ITEM_NOT_AVAILABLE, "Item is not available for purchase: " + itemId);
    }
}
