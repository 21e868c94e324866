package com.flagship.game_economy.shop.requirement;

/**
 * The facts a purchase requirement can look at, captured under the purchase's locks.
 */
public record PurchaseContext(long balance, int ownedQuantity, int requestedQuantity) {
}
