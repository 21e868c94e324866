package com.flagship.game_economy.shop.requirement;

/**
 * A condition a competitor must meet to buy a shop item.
 * Implementations are plain data; new kinds are added here, never configured as code.
 */
public interface PurchaseRequirement {

    boolean isSatisfiedBy(PurchaseContext context);

    /**
     * Human-readable form used in error messages, e.g. {@code OWNED_QUANTITY < 1}.
     */
    String describe();
}
