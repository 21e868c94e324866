package com.flagship.game_economy.trade;

import com.flagship.game_economy.common.exception.InsufficientFundsException;
import com.flagship.game_economy.common.exception.InsufficientQuantityException;
import com.flagship.game_economy.common.exception.RecipientNotFoundException;
import com.flagship.game_economy.inventory.InventoryEntry;
import com.flagship.game_economy.inventory.InventoryKey;
import com.flagship.game_economy.inventory.InventoryStore;
import com.flagship.game_economy.ledger.CurrencyBalance;
import com.flagship.game_economy.ledger.LedgerService;
import com.flagship.game_economy.ledger.TransactionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Moves everything an accepted offer names, or nothing.
 *
 * The caller holds the offer row lock. Holdings checked at offer creation are only
 * advisory: every contributor's inventory row and both balances are locked and
 * re-checked here before the first write.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TradeSettlement {

    private final InventoryStore inventoryStore;
    private final LedgerService ledgerService;

    @Transactional(propagation = Propagation.MANDATORY)
    public void settle(TradeOffer offer) {
        List<TradeItem> items = offer.getItems();

        Map<UUID, CurrencyBalance> balances = Map.of();
        if (offer.getOfferedCurrency() > 0 || offer.getRequestedCurrency() > 0) {
            balances = ledgerService.lockBalances(offer.getFromCompetitorId(), offer.getToCompetitorId());
        }

        // Lock every row the settlement touches, givers and receivers alike, in one global order
        List<InventoryKey> keys = items.stream()
                .flatMap(item -> Stream.of(
                        new InventoryKey(offer.giverOf(item), item.getItemId()),
                        new InventoryKey(offer.receiverOf(item), item.getItemId())))
                .toList();
        Map<InventoryKey, InventoryEntry> locked = inventoryStore.lockAll(keys);

        Map<InventoryKey, Integer> required = items.stream()
                .collect(Collectors.groupingBy(
                        item -> new InventoryKey(offer.giverOf(item), item.getItemId()),
                        Collectors.summingInt(TradeItem::getQuantity)));
        for (TradeItem item : items) {
            InventoryKey giver = new InventoryKey(offer.giverOf(item), item.getItemId());
            InventoryEntry entry = locked.get(giver);
            int available = entry != null ? entry.getQuantity() : 0;
            int needed = required.get(giver);
            if (available < needed) {
                throw new InsufficientQuantityException(giver.competitorId(), item.getItemId(), needed, available);
            }
        }

        checkCurrencyLegs(offer, balances);

        Instant now = Instant.now();
        for (TradeItem item : items) {
            if (!inventoryStore.decrement(offer.giverOf(item), item.getItemId(), item.getQuantity())) {
                throw new IllegalStateException("Inventory row changed while locked: "
                        + offer.giverOf(item) + "/" + item.getItemId());
            }
            inventoryStore.increment(offer.receiverOf(item), item.getItemId(), item.getQuantity(), now);
        }

        String reason = "Trade " + offer.getId();
        if (offer.getOfferedCurrency() > 0) {
            ledgerService.transferTyped(offer.getFromCompetitorId(), offer.getToCompetitorId(),
                    offer.getOfferedCurrency(), reason, TransactionType.TRADE);
        }
        if (offer.getRequestedCurrency() > 0) {
            ledgerService.transferTyped(offer.getToCompetitorId(), offer.getFromCompetitorId(),
                    offer.getRequestedCurrency(), reason, TransactionType.TRADE);
        }

        log.info("Trade {} settled: {} item lines, offered={}, requested={}",
                offer.getId(), items.size(), offer.getOfferedCurrency(), offer.getRequestedCurrency());
    }

    /**
     * The offered leg runs first, so the recipient may pay the requested amount out of what it receives.
     */
    private void checkCurrencyLegs(TradeOffer offer, Map<UUID, CurrencyBalance> balances) {
        long offered = offer.getOfferedCurrency();
        long requested = offer.getRequestedCurrency();
        if (offered == 0 && requested == 0) {
            return;
        }
        CurrencyBalance from = balances.get(offer.getFromCompetitorId());
        CurrencyBalance to = balances.get(offer.getToCompetitorId());

        long fromAvailable = from != null ? from.getBalance() : 0L;
        long toAvailable = to != null ? to.getBalance() : 0L;
        if (offered > 0) {
            if (from == null || fromAvailable < offered) {
                throw new InsufficientFundsException(offer.getFromCompetitorId(), offered, fromAvailable);
            }
            if (to == null) {
                throw new RecipientNotFoundException(offer.getToCompetitorId());
            }
            toAvailable += offered;
        }
        if (requested > 0) {
            if (to == null || toAvailable < requested) {
                throw new InsufficientFundsException(offer.getToCompetitorId(), requested, toAvailable);
            }
            if (from == null) {
                throw new RecipientNotFoundException(offer.getFromCompetitorId());
            }
        }
    }
}
