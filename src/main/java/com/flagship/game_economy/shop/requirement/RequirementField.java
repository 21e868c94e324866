package com.flagship.game_economy.shop.requirement;

import java.util.function.ToLongFunction;

/**
 * The closed set of values a purchase requirement may test.
 */
public enum RequirementField {
    BALANCE(PurchaseContext::balance),
    OWNED_QUANTITY(PurchaseContext::ownedQuantity),
    PURCHASE_QUANTITY(PurchaseContext::requestedQuantity);

    private final ToLongFunction<PurchaseContext> extractor;

    RequirementField(ToLongFunction<PurchaseContext> extractor) {
        this.extractor = extractor;
    }

    public long valueIn(PurchaseContext context) {
        return extractor.applyAsLong(context);
    }
}
