package com.flagship.game_economy.shop;

import com.flagship.game_economy.common.exception.InsufficientFundsException;
import com.flagship.game_economy.common.exception.ItemNotAvailableException;
import com.flagship.game_economy.common.exception.ItemNotFoundException;
import com.flagship.game_economy.common.exception.OutOfStockException;
import com.flagship.game_economy.common.exception.RequirementNotMetException;
import com.flagship.game_economy.inventory.InventoryEntry;
import com.flagship.game_economy.inventory.InventoryService;
import com.flagship.game_economy.ledger.LedgerService;
import com.flagship.game_economy.outbox.OutboxEvent;
import com.flagship.game_economy.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class ShopServiceTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("game_economy_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("economy.trade.expiry.sweep-enabled", () -> "false");
    }

    @Autowired
    private ShopService shopService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private InventoryService inventoryService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final UUID gameId = UUID.randomUUID();
    private UUID alice;

    @BeforeEach
    void setUp() {
        alice = UUID.randomUUID();
        ledgerService.openBalance(alice, gameId, 500);
    }

    private UUID createItem(long price, Integer stock, boolean available) {
        UUID itemId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO shop_items (id, game_id, name, price, stock, available, rarity) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?)", itemId, gameId, "Item " + itemId.toString().substring(0, 8),
                price, stock, available, "COMMON");
        return itemId;
    }

    private Integer stockOf(UUID itemId) {
        return jdbcTemplate.queryForObject("SELECT stock FROM shop_items WHERE id = ?", Integer.class, itemId);
    }

    private int owned(UUID itemId) {
        return inventoryService.getInventory(alice).stream()
                .filter(entry -> entry.getItemId().equals(itemId))
                .mapToInt(InventoryEntry::getQuantity)
                .sum();
    }

    private long balance() {
        return ledgerService.getBalance(alice).getBalance();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("A purchase charges the total, takes stock and grants the items")
    void testPurchase() {
        printTestHeader("Shop Purchase");
        UUID potion = createItem(40, 10, true);

        PurchaseReceipt receipt = shopService.purchaseItem(alice, potion, 3);

        assertEquals(120, receipt.totalPrice());
        assertEquals(40, receipt.pricePerUnit());
        assertEquals(380, receipt.balanceAfter());
        assertEquals(380, balance());
        assertEquals(7, stockOf(potion));
        assertEquals(3, owned(potion));

        List<OutboxEvent> events = outboxService.getEventsForAggregate("Shop", receipt.purchaseId());
        assertEquals(1, events.size());
        assertEquals("ItemPurchased", events.get(0).getEventType());
        printSuccess("Balance 500 -> 380, stock 10 -> 7, owned 3");
    }

    @Test
    @DisplayName("Unlimited stock stays unlimited")
    void testUnlimitedStock() {
        UUID badge = createItem(10, null, true);

        shopService.purchaseItem(alice, badge, 5);

        assertNull(stockOf(badge));
        assertEquals(5, owned(badge));
    }

    @Test
    @DisplayName("Buying more than the stock fails without charging")
    void testOutOfStock() {
        UUID rare = createItem(10, 2, true);

        assertThrows(OutOfStockException.class, () -> shopService.purchaseItem(alice, rare, 3));

        assertEquals(2, stockOf(rare));
        assertEquals(500, balance());
    }

    @Test
    @DisplayName("Unavailable and unknown items are rejected")
    void testUnavailableItems() {
        UUID retired = createItem(10, 5, false);

        assertThrows(ItemNotAvailableException.class, () -> shopService.purchaseItem(alice, retired, 1));
        assertThrows(ItemNotFoundException.class, () -> shopService.purchaseItem(alice, UUID.randomUUID(), 1));
    }

    @Test
    @DisplayName("A failed payment leaves stock and inventory untouched")
    void testInsufficientFunds() {
        UUID armor = createItem(300, 5, true);

        assertThrows(InsufficientFundsException.class, () -> shopService.purchaseItem(alice, armor, 2));

        assertEquals(5, stockOf(armor));
        assertEquals(0, owned(armor));
        assertEquals(500, balance());
    }

    @Test
    @DisplayName("Purchase requirements are checked against the buyer's holdings")
    void testRequirement() {
        printTestHeader("Purchase Requirement");
        UUID starterPack = createItem(50, null, true);
        jdbcTemplate.update("INSERT INTO shop_item_requirements (id, item_id, kind, field, operator, threshold) " +
                "VALUES (?, ?, 'FIELD_COMPARISON', 'OWNED_QUANTITY', 'LT', 1)", UUID.randomUUID(), starterPack);

        shopService.purchaseItem(alice, starterPack, 1);

        assertThrows(RequirementNotMetException.class, () -> shopService.purchaseItem(alice, starterPack, 1));
        assertEquals(1, owned(starterPack));
        assertEquals(450, balance());
        printSuccess("Second starter pack rejected");
    }
}
