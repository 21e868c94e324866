package com.flagship.game_economy.inventory;

import com.flagship.game_economy.common.exception.InsufficientQuantityException;
import com.flagship.game_economy.common.exception.InvalidRequestException;
import com.flagship.game_economy.common.exception.ItemNotFoundException;
import com.flagship.game_economy.observability.EconomyMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Inventory operations that stand on their own: reading, consuming and granting items.
 * Trade settlement moves items through {@link InventoryStore} directly under its own locks.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryService {

    private final InventoryStore inventoryStore;
    private final ItemUsageRepository itemUsageRepository;
    private final EconomyMetrics metrics;

    @Transactional(readOnly = true)
    public List<InventoryEntry> getInventory(UUID competitorId) {
        return inventoryStore.findByCompetitor(competitorId);
    }

    /**
     * Consumes {@code quantity} of an item and logs the usage.
     *
     * @throws ItemNotFoundException if the competitor has never held the item
     * @throws InsufficientQuantityException if the competitor holds fewer than {@code quantity}
     */
    @Transactional
    public InventoryEntry useItem(UUID competitorId, UUID itemId, int quantity) {
        requirePositive(quantity);

        InventoryEntry entry = inventoryStore.lock(competitorId, itemId)
                .orElseThrow(() -> new ItemNotFoundException(competitorId, itemId));
        if (!entry.holds(quantity)) {
            throw new InsufficientQuantityException(competitorId, itemId, quantity, entry.getQuantity());
        }

        Instant now = Instant.now();
        inventoryStore.recordUse(competitorId, itemId, quantity, now);
        itemUsageRepository.save(new ItemUsageEntity(UUID.randomUUID(), competitorId, itemId, quantity, now));

        metrics.recordItemUsed();
        log.info("Item used: competitor={}, item={}, quantity={}", competitorId, itemId, quantity);

        return new InventoryEntry(
            entry.getId(),
            competitorId,
            itemId,
            entry.getQuantity() - quantity,
            entry.getUseCount() + 1,
            entry.getLastAcquiredAt(),
            now
        );
    }

    /**
     * Grants items to a competitor (shop purchases, season rewards).
     */
    @Transactional
    public void acquire(UUID competitorId, UUID itemId, int quantity) {
        requirePositive(quantity);
        inventoryStore.increment(competitorId, itemId, quantity, Instant.now());
        log.debug("Item acquired: competitor={}, item={}, quantity={}", competitorId, itemId, quantity);
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new InvalidRequestException("Quantity must be positive");
        }
    }
}
