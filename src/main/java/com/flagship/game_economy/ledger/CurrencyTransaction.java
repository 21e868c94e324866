package com.flagship.game_economy.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable ledger log row. One row per completed currency movement.
 *
 * A null {@code fromCompetitorId} is a system mint, a null {@code toCompetitorId}
 * is a burn (currency spent into the system).
 */
@Value
public class CurrencyTransaction {
    UUID id;
    UUID fromCompetitorId;
    UUID toCompetitorId;
    long amount;
    String reason;
    TransactionStatus status;
    TransactionType type;
    String idempotencyKey;
    Instant createdAt;

    public boolean isMint() {
        return fromCompetitorId == null;
    }

    public boolean isBurn() {
        return toCompetitorId == null;
    }
}
