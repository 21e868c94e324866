package com.flagship.game_economy.trade.event;

import com.flagship.game_economy.common.event.EconomyEvent;
import com.flagship.game_economy.trade.TradeOffer;
import com.flagship.game_economy.trade.TradeStatus;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An offer reached a terminal state. The event type names the state,
 * e.g. TradeCompleted or TradeExpired.
 */
@Value
public class TradeResolvedEvent implements EconomyEvent {
    UUID eventId;
    UUID tradeId;
    UUID fromCompetitorId;
    UUID toCompetitorId;
    TradeStatus status;
    Instant occurredAt;

    public static TradeResolvedEvent fromOffer(TradeOffer offer) {
        return new TradeResolvedEvent(
            UUID.randomUUID(),
            offer.getId(),
            offer.getFromCompetitorId(),
            offer.getToCompetitorId(),
            offer.getStatus(),
            Instant.now()
        );
    }

    @Override
    public String getEventType() {
        String name = status.name();
        return "Trade" + name.charAt(0) + name.substring(1).toLowerCase();
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
        return List.of(fromCompetitorId, toCompetitorId);
    }
}
