package com.flagship.game_economy.trade.event;

import com.flagship.game_economy.common.event.EconomyEvent;
import com.flagship.game_economy.trade.TradeOffer;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A new offer is waiting for the recipient's answer.
 */
@Value
public class TradeOfferCreatedEvent implements EconomyEvent {
    public static final String EVENT_TYPE = "TradeOfferCreated";

    UUID eventId;
    UUID tradeId;
    UUID fromCompetitorId;
    UUID toCompetitorId;
    long offeredCurrency;
    long requestedCurrency;
    int itemCount;
    Instant expiresAt;
    Instant occurredAt;

    public static TradeOfferCreatedEvent fromOffer(TradeOffer offer) {
        return new TradeOfferCreatedEvent(
            UUID.randomUUID(),
            offer.getId(),
            offer.getFromCompetitorId(),
            offer.getToCompetitorId(),
            offer.getOfferedCurrency(),
            offer.getRequestedCurrency(),
            offer.getItems().size(),
            offer.getExpiresAt(),
            Instant.now()
        );
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return "Trade";
    }

    @Override
    public UUID getAggregateId() {
        return tradeId;
    }

    @Override
    public List<UUID> getRecipientIds() {
        return List.of(toCompetitorId);
    }
}
