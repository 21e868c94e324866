package com.flagship.game_economy.trade;

import lombok.Value;

import java.util.UUID;

/**
 * One line of a trade. {@code fromCompetitor} is true when the offering competitor gives
 * the item, false when the offer asks the recipient for it.
 */
@Value
public class TradeItem {
    UUID itemId;
    int quantity;
    boolean fromCompetitor;
}
