package com.flagship.game_economy.shop;

import com.flagship.game_economy.common.exception.InvalidRequestException;
import com.flagship.game_economy.common.exception.ItemNotAvailableException;
import com.flagship.game_economy.common.exception.ItemNotFoundException;
import com.flagship.game_economy.common.exception.OutOfStockException;
import com.flagship.game_economy.common.exception.RequirementNotMetException;
import com.flagship.game_economy.inventory.InventoryEntry;
import com.flagship.game_economy.inventory.InventoryService;
import com.flagship.game_economy.inventory.InventoryStore;
import com.flagship.game_economy.ledger.CurrencyBalance;
import com.flagship.game_economy.ledger.CurrencyTransaction;
import com.flagship.game_economy.ledger.LedgerService;
import com.flagship.game_economy.ledger.TransactionType;
import com.flagship.game_economy.observability.EconomyMetrics;
import com.flagship.game_economy.outbox.OutboxService;
import com.flagship.game_economy.shop.event.ItemPurchasedEvent;
import com.flagship.game_economy.shop.requirement.PurchaseContext;
import com.flagship.game_economy.shop.requirement.PurchaseRequirement;
import com.flagship.game_economy.shop.requirement.ShopItemRequirementEntity;
import com.flagship.game_economy.shop.requirement.ShopItemRequirementRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Buying shop items with currency.
 *
 * The item row is locked first, so concurrent purchases of a limited item serialize
 * and stock never goes negative. Payment is a burn through the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShopService {

    private final ShopItemRepository shopItemRepository;
    private final ShopItemRequirementRepository requirementRepository;
    private final ShopTransactionRepository shopTransactionRepository;
    private final LedgerService ledgerService;
    private final InventoryService inventoryService;
    private final InventoryStore inventoryStore;
    private final OutboxService outboxService;
    private final EconomyMetrics metrics;

    @Transactional
    public PurchaseReceipt purchaseItem(UUID competitorId, UUID itemId, int quantity) {
        if (quantity <= 0) {
            throw new InvalidRequestException("Quantity must be positive");
        }

        ShopItemEntity item = shopItemRepository.findByIdForUpdate(itemId)
                .orElseThrow(() -> new ItemNotFoundException(itemId));
        if (!item.isAvailable()) {
            metrics.recordPurchase("not_available");
            throw new ItemNotAvailableException(itemId);
        }
        if (!item.hasStockFor(quantity)) {
            metrics.recordPurchase("out_of_stock");
            throw new OutOfStockException(itemId, quantity, item.getStock());
        }

        long totalPrice;
        try {
            totalPrice = Math.multiplyExact(item.getPrice(), (long) quantity);
        } catch (ArithmeticException e) {
            throw new InvalidRequestException("Purchase total is too large");
        }

        CurrencyBalance balance = ledgerService.lockBalances(competitorId).get(competitorId);
        PurchaseContext context = new PurchaseContext(
            balance != null ? balance.getBalance() : 0L,
            inventoryStore.find(competitorId, itemId).map(InventoryEntry::getQuantity).orElse(0),
            quantity
        );
        for (ShopItemRequirementEntity row : requirementRepository.findByItemId(itemId)) {
            PurchaseRequirement requirement = row.toRequirement();
            if (!requirement.isSatisfiedBy(context)) {
                metrics.recordPurchase("requirement_not_met");
                throw new RequirementNotMetException(requirement.describe());
            }
        }

        CurrencyTransaction payment = ledgerService.burn(competitorId, totalPrice,
                "Purchase of " + quantity + " x " + item.getName(), TransactionType.PURCHASE);

        item.takeStock(quantity);
        shopItemRepository.save(item);
        inventoryService.acquire(competitorId, itemId, quantity);

        Instant now = Instant.now();
        ShopTransactionEntity purchase = shopTransactionRepository.save(new ShopTransactionEntity(
            UUID.randomUUID(),
            competitorId,
            itemId,
            quantity,
            item.getPrice(),
            totalPrice,
            payment.getId(),
            now
        ));

        PurchaseReceipt receipt = new PurchaseReceipt(
            purchase.getId(),
            competitorId,
            itemId,
            quantity,
            item.getPrice(),
            totalPrice,
            payment.getId(),
            context.balance() - totalPrice,
            now
        );
        outboxService.saveEvent(ItemPurchasedEvent.fromReceipt(receipt));

        metrics.recordPurchase("success");
        log.info("Shop purchase: competitor={}, item={}, quantity={}, total={}",
                competitorId, itemId, quantity, totalPrice);
        return receipt;
    }
}
