package com.flagship.game_economy.trade;

import com.flagship.game_economy.common.exception.InvalidTradeException;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Trade offer with an explicit state machine.
 *
 * Transitions return a new instance; any transition out of a terminal state
 * fails with {@link InvalidTradeException}.
 */
@Value
public class TradeOffer {
    UUID id;
    UUID fromCompetitorId;
    UUID toCompetitorId;
    TradeStatus status;
    long offeredCurrency;
    long requestedCurrency;
    String message;
    List<TradeItem> items;
    Instant expiresAt;
    Instant createdAt;
    Instant completedAt;

    public static TradeOffer create(UUID fromCompetitorId, UUID toCompetitorId, List<TradeItem> items,
                                    long offeredCurrency, long requestedCurrency, String message,
                                    Duration ttl) {
        Instant now = Instant.now();
        return new TradeOffer(
            UUID.randomUUID(),
            fromCompetitorId,
            toCompetitorId,
            TradeStatus.PENDING,
            offeredCurrency,
            requestedCurrency,
            message,
            List.copyOf(items),
            now.plus(ttl),
            now,
            null
        );
    }

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean canTransitionTo(TradeStatus target) {
        return status == TradeStatus.PENDING && target != TradeStatus.PENDING;
    }

    public TradeOffer complete() {
        return transitionTo(TradeStatus.COMPLETED);
    }

    public TradeOffer reject() {
        return transitionTo(TradeStatus.REJECTED);
    }

    public TradeOffer cancel() {
        return transitionTo(TradeStatus.CANCELLED);
    }

    public TradeOffer expire() {
        return transitionTo(TradeStatus.EXPIRED);
    }

    /**
     * Items the offering competitor gives.
     */
    public List<TradeItem> offeredItems() {
        return items.stream().filter(TradeItem::isFromCompetitor).toList();
    }

    /**
     * Items the recipient gives in return.
     */
    public List<TradeItem> requestedItems() {
        return items.stream().filter(item -> !item.isFromCompetitor()).toList();
    }

    /**
     * The competitor who hands over {@code item} at settlement.
     */
    public UUID giverOf(TradeItem item) {
        return item.isFromCompetitor() ? fromCompetitorId : toCompetitorId;
    }

    public UUID receiverOf(TradeItem item) {
        return item.isFromCompetitor() ? toCompetitorId : fromCompetitorId;
    }

    private TradeOffer transitionTo(TradeStatus target) {
        if (!canTransitionTo(target)) {
            throw new InvalidTradeException(
                String.format("Cannot move trade %s from %s to %s", id, status, target));
        }
        return new TradeOffer(
            id,
            fromCompetitorId,
            toCompetitorId,
            target,
            offeredCurrency,
            requestedCurrency,
            message,
            items,
            expiresAt,
            createdAt,
            Instant.now()
        );
    }
}
