package com.flagship.game_economy.common.exception;

import java.util.UUID;

public class OutOfStockException extends EconomyException {

    public OutOfStockException(UUID itemId, int requested, int stock) {
        super(ErrorCode.OUT_OF_STOCK, String.format(
                "Item %s is out of stock: requested=%d, stock=%d", itemId, requested, stock));
    }
}
