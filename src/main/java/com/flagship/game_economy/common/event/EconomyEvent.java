package com.flagship.game_economy.common.event;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A fact about the economy, written to the outbox in the transaction that caused it.
 *
 * Every serialized event carries eventId, eventType, aggregateType, aggregateId and
 * recipientIds, which is all the consumer needs to deduplicate and fan it out.
 */
public interface EconomyEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    String getEventType();

    String getAggregateType();

    UUID getAggregateId();

    Instant getOccurredAt();

    /**
     * Competitors who should be told about this event in real time.
     */
    List<UUID> getRecipientIds();
}
