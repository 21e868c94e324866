package com.flagship.game_economy.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A competitor's currency balance within one game.
 * Only mutated through {@link LedgerService}; balance is never negative.
 */
@Value
public class CurrencyBalance {
    UUID id;
    UUID competitorId;
    UUID gameId;
    long balance;
    Instant updatedAt;

    public boolean covers(long amount) {
        return balance >= amount;
    }
}
