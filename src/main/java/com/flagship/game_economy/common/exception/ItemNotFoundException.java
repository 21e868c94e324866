package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class ItemNotFoundException extends EconomyException {

    public ItemNotFoundException(UUID itemId) {
        super(ErrorCode.ITEM_NOT_FOUND, "Item not found: " + itemId);
    }

    public ItemNotFoundException(UUID competitorId, UUID itemId) {
        super(ErrorCode.ITEM_NOT_FOUND, String.format(
                "Item %s not found in inventory of competitor %s", itemId, competitorId));
    }
}
