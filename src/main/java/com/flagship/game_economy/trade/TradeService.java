package com.flagship.game_economy.trade;

import com.flagship.game_economy.common.exception.InsufficientFundsException;
import com.flagship.game_economy.common.exception.InsufficientQuantityException;
import com.flagship.game_economy.common.exception.InvalidRequestException;
import com.flagship.game_economy.common.exception.InvalidTradeException;
import com.flagship.game_economy.common.exception.TradeNotFoundException;
import com.flagship.game_economy.config.EconomyProperties;
import com.flagship.game_economy.inventory.InventoryEntry;
import com.flagship.game_economy.inventory.InventoryKey;
import com.flagship.game_economy.inventory.InventoryStore;
import com.flagship.game_economy.ledger.CurrencyBalance;
import com.flagship.game_economy.ledger.LedgerService;
import com.flagship.game_economy.observability.CorrelationContext;
import com.flagship.game_economy.observability.EconomyMetrics;
import com.flagship.game_economy.outbox.OutboxService;
import com.flagship.game_economy.trade.event.TradeOfferCreatedEvent;
import com.flagship.game_economy.trade.event.TradeResolvedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Peer-to-peer trade offers.
 *
 * Offers start PENDING and end in exactly one of COMPLETED, REJECTED, CANCELLED or EXPIRED.
 * Every mutating call locks the offer row first, so two concurrent responses to one offer
 * serialize and the second sees a terminal state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TradeService {

    private final TradeOfferRepository tradeOfferRepository;
    private final InventoryStore inventoryStore;
    private final LedgerService ledgerService;
    private final TradeSettlement tradeSettlement;
    private final OutboxService outboxService;
    private final EconomyProperties properties;
    private final EconomyMetrics metrics;

    /**
     * Creates a PENDING offer after checking that the offering competitor currently holds
     * every offered item and the offered currency. These checks reserve nothing;
     * settlement re-validates.
     *
     * @throws InsufficientQuantityException naming the first offered item that is short
     * @throws InsufficientFundsException if the offered currency exceeds the offerer's balance
     */
    @Transactional
    public TradeOffer createOffer(UUID fromCompetitorId, UUID toCompetitorId, List<TradeItem> items,
                                  long offeredCurrency, long requestedCurrency, String message) {
        validateShape(fromCompetitorId, toCompetitorId, items, offeredCurrency, requestedCurrency);

        Map<UUID, Integer> offeredByItem = new LinkedHashMap<>();
        items.stream()
                .filter(TradeItem::isFromCompetitor)
                .forEach(item -> offeredByItem.merge(item.getItemId(), item.getQuantity(), Integer::sum));

        Map<InventoryKey, InventoryEntry> holdings = inventoryStore.lockAll(
                offeredByItem.keySet().stream().map(itemId -> new InventoryKey(fromCompetitorId, itemId)).toList());
        for (Map.Entry<UUID, Integer> offered : offeredByItem.entrySet()) {
            InventoryEntry entry = holdings.get(new InventoryKey(fromCompetitorId, offered.getKey()));
            int available = entry != null ? entry.getQuantity() : 0;
            if (available < offered.getValue()) {
                throw new InsufficientQuantityException(fromCompetitorId, offered.getKey(), offered.getValue(), available);
            }
        }

        if (offeredCurrency > 0) {
            long available = ledgerService.findBalance(fromCompetitorId).map(CurrencyBalance::getBalance).orElse(0L);
            if (available < offeredCurrency) {
                throw new InsufficientFundsException(fromCompetitorId, offeredCurrency, available);
            }
        }

        TradeOffer offer = TradeOffer.create(fromCompetitorId, toCompetitorId, items,
                offeredCurrency, requestedCurrency, message, properties.trade().offerTtl());
        tradeOfferRepository.save(TradeOfferEntity.fromDomain(offer));
        outboxService.saveEvent(TradeOfferCreatedEvent.fromOffer(offer));

        metrics.recordTrade(TradeStatus.PENDING.name());
        log.info("Trade offer created: tradeId={}, from={}, to={}, items={}, expiresAt={}",
                offer.getId(), fromCompetitorId, toCompetitorId, items.size(), offer.getExpiresAt());
        return offer;
    }

    /**
     * Accepts or rejects an offer on behalf of its recipient.
     * A failed settlement fails the whole call and leaves the offer PENDING.
     *
     * @throws InvalidTradeException if the responder is not the recipient, or the offer is
     *         no longer PENDING or has expired
     */
    @Transactional
    public TradeOffer respond(UUID tradeId, UUID responderId, boolean accept) {
        MDC.put(CorrelationContext.TRADE_ID_MDC_KEY, tradeId.toString());
        try {
            TradeOfferEntity entity = tradeOfferRepository.findByIdForUpdate(tradeId)
                    .orElseThrow(() -> new TradeNotFoundException(tradeId));
            TradeOffer offer = entity.toDomain();

            if (!offer.getToCompetitorId().equals(responderId)) {
                throw new InvalidTradeException("Only the recipient can respond to trade " + tradeId);
            }
            requireOpen(offer);

            TradeOffer resolved;
            if (accept) {
                metrics.timeSettlement(() -> {
                    tradeSettlement.settle(offer);
                    return null;
                });
                resolved = offer.complete();
            } else {
                resolved = offer.reject();
            }

            return resolve(entity, resolved);
        } finally {
            MDC.remove(CorrelationContext.TRADE_ID_MDC_KEY);
        }
    }

    /**
     * Withdraws a PENDING offer on behalf of the competitor who made it.
     */
    @Transactional
    public TradeOffer cancel(UUID tradeId, UUID requesterId) {
        TradeOfferEntity entity = tradeOfferRepository.findByIdForUpdate(tradeId)
                .orElseThrow(() -> new TradeNotFoundException(tradeId));
        TradeOffer offer = entity.toDomain();

        if (!offer.getFromCompetitorId().equals(requesterId)) {
            throw new InvalidTradeException("Only the offering competitor can cancel trade " + tradeId);
        }
        if (offer.isTerminal()) {
            throw new InvalidTradeException("Trade " + tradeId + " is already " + offer.getStatus());
        }

        return resolve(entity, offer.cancel());
    }

    @Transactional(readOnly = true)
    public TradeOffer getTrade(UUID tradeId) {
        return tradeOfferRepository.findById(tradeId)
                .map(TradeOfferEntity::toDomain)
                .orElseThrow(() -> new TradeNotFoundException(tradeId));
    }

    /**
     * Open offers the competitor sent or received, newest first.
     */
    @Transactional(readOnly = true)
    public List<TradeOffer> listPendingFor(UUID competitorId) {
        return tradeOfferRepository.findOpenOffersInvolving(competitorId, Instant.now())
                .stream()
                .map(TradeOfferEntity::toDomain)
                .toList();
    }

    /**
     * Marks up to {@code batchSize} stale PENDING offers EXPIRED.
     *
     * @return number of offers expired
     */
    @Transactional
    public int expireStaleOffers(int batchSize) {
        List<TradeOfferEntity> stale = tradeOfferRepository.findExpiredPendingForUpdate(Instant.now(), batchSize);
        stale.forEach(entity -> resolve(entity, entity.toDomain().expire()));
        if (!stale.isEmpty()) {
            log.info("Expired {} stale trade offers", stale.size());
        }
        return stale.size();
    }

    private TradeOffer resolve(TradeOfferEntity entity, TradeOffer resolved) {
        entity.applyTransition(resolved);
        tradeOfferRepository.save(entity);
        outboxService.saveEvent(TradeResolvedEvent.fromOffer(resolved));

        metrics.recordTrade(resolved.getStatus().name());
        log.info("Trade {} -> {}", resolved.getId(), resolved.getStatus());
        return resolved;
    }

    private static void requireOpen(TradeOffer offer) {
        if (offer.isTerminal()) {
            throw new InvalidTradeException("Trade " + offer.getId() + " is already " + offer.getStatus());
        }
        if (offer.isExpiredAt(Instant.now())) {
            throw new InvalidTradeException("Trade " + offer.getId() + " has expired");
        }
    }

    private static void validateShape(UUID fromCompetitorId, UUID toCompetitorId, List<TradeItem> items,
                                      long offeredCurrency, long requestedCurrency) {
        if (fromCompetitorId == null || toCompetitorId == null) {
            throw new InvalidRequestException("Both competitors are required");
        }
        if (fromCompetitorId.equals(toCompetitorId)) {
            throw new InvalidTradeException("A competitor cannot trade with themselves");
        }
        if (offeredCurrency < 0 || requestedCurrency < 0) {
            throw new InvalidRequestException("Currency amounts cannot be negative");
        }
        if (items.isEmpty() && offeredCurrency == 0 && requestedCurrency == 0) {
            throw new InvalidTradeException("A trade must include at least one item or currency amount");
        }
        for (TradeItem item : items) {
            if (item.getItemId() == null || item.getQuantity() <= 0) {
                throw new InvalidRequestException("Every trade item needs an item id and a positive quantity");
            }
        }
    }
}
