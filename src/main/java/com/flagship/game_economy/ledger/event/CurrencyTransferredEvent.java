package com.flagship.game_economy.ledger.event;

import com.flagship.game_economy.common.event.EconomyEvent;
import com.flagship.game_economy.ledger.CurrencyTransaction;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A competitor sent currency to another competitor.
 */
@Value
public class CurrencyTransferredEvent implements EconomyEvent {
    public static final String EVENT_TYPE = "CurrencyTransferred";

    UUID eventId;
    UUID transactionId;
    UUID fromCompetitorId;
    UUID toCompetitorId;
    long amount;
    String reason;
    Instant occurredAt;

    public static CurrencyTransferredEvent fromTransaction(CurrencyTransaction transaction) {
        return new CurrencyTransferredEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getFromCompetitorId(),
            transaction.getToCompetitorId(),
            transaction.getAmount(),
            transaction.getReason(),
            transaction.getCreatedAt()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Currency";
    }

    @Override
    public UUID getAggregateId() {
        return transactionId;
    }

    @Override
    public List<UUID> getRecipientIds() {
        return List.of(toCompetitorId);
    }
}
