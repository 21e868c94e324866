package com.flagship.game_economy.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An economy event waiting in (or already drained from) the outbox.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // Trade, Currency, Season, Shop
    UUID aggregateId;
    String eventType;
    String payload;            // event serialized as JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public boolean isPublished() {
        return publishedAt != null;
    }
}
