package com.flagship.game_economy.ledger;

import com.flagship.game_economy.common.exception.InsufficientFundsException;
import com.flagship.game_economy.common.exception.InvalidRequestException;
import com.flagship.game_economy.common.exception.RecipientNotFoundException;
import com.flagship.game_economy.outbox.OutboxEvent;
import com.flagship.game_economy.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the currency ledger: overdrafts, phantom recipients, replays
 * and concurrent debits against one balance.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class LedgerServiceTest {

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
    private LedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private final UUID gameId = UUID.randomUUID();
    private UUID alice;
    private UUID bob;

    @BeforeEach
    void setUp() {
        alice = UUID.randomUUID();
        bob = UUID.randomUUID();
        ledgerService.openBalance(alice, gameId, 100);
        ledgerService.openBalance(bob, gameId, 0);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private long balanceOf(UUID competitorId) {
        return ledgerService.getBalance(competitorId).getBalance();
    }

    private int transactionCount(UUID competitorId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM currency_transactions WHERE from_competitor_id = ? OR to_competitor_id = ?",
            Integer.class, competitorId, competitorId);
        return count != null ? count : 0;
    }

    @Nested
    @DisplayName("Opening balances")
    class OpenBalance {

        @Test
        @DisplayName("The opening amount is minted and logged")
        void testOpeningMint() {
            printTestHeader("Opening Balance Mint");

            List<CurrencyTransaction> history = ledgerService.getHistory(alice, 10);

            assertEquals(100, balanceOf(alice));
            assertEquals(1, history.size());
            assertNull(history.get(0).getFromCompetitorId());
            assertEquals(TransactionType.REWARD, history.get(0).getType());
            printSuccess("Opening amount recorded as a mint");
        }

        @Test
        @DisplayName("Opening twice keeps the first balance")
        void testOpenTwice() {
            ledgerService.openBalance(alice, gameId, 500);

            assertEquals(100, balanceOf(alice));
            assertEquals(1, transactionCount(alice));
        }
    }

    @Nested
    @DisplayName("Transfers")
    class Transfers {

        @Test
        @DisplayName("A transfer moves the amount and conserves the total")
        void testConservation() {
            printTestHeader("Transfer Conserves Currency");

            CurrencyTransaction tx = ledgerService.transfer(alice, bob, 40, "gg");

            assertEquals(TransactionStatus.COMPLETED, tx.getStatus());
            assertEquals(TransactionType.TRANSFER, tx.getType());
            assertEquals(60, balanceOf(alice));
            assertEquals(40, balanceOf(bob));
            assertEquals(100, balanceOf(alice) + balanceOf(bob));
            printSuccess("Sum of balances unchanged: 100");
        }

        @Test
        @DisplayName("A transfer writes exactly one outbox event")
        void testOutboxEvent() {
            CurrencyTransaction tx = ledgerService.transfer(alice, bob, 10, null);

            List<OutboxEvent> events = outboxService.getEventsForAggregate("Currency", tx.getId());

            assertEquals(1, events.size());
            assertEquals("CurrencyTransferred", events.get(0).getEventType());
            assertTrue(events.get(0).getPayload().contains(bob.toString()));
        }

        @Test
        @DisplayName("An overdraft fails and changes nothing")
        void testInsufficientFunds() {
            printTestHeader("Overdraft Rejected");

            InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                    () -> ledgerService.transfer(alice, bob, 101, "too much"));

            assertEquals(100, balanceOf(alice));
            assertEquals(0, balanceOf(bob));
            assertEquals(1, transactionCount(alice));
            printSuccess("Rejected: " + e.getMessage());
        }

        @Test
        @DisplayName("Sending to a competitor without a balance fails")
        void testRecipientNotFound() {
            UUID ghost = UUID.randomUUID();

            assertThrows(RecipientNotFoundException.class, () -> ledgerService.transfer(alice, ghost, 10, null));
            assertEquals(100, balanceOf(alice));
        }

        @Test
        @DisplayName("A sender without funds is reported before a missing recipient")
        void testErrorOrder() {
            UUID ghost = UUID.randomUUID();

            assertThrows(InsufficientFundsException.class, () -> ledgerService.transfer(bob, ghost, 10, null));
            assertThrows(InsufficientFundsException.class,
                    () -> ledgerService.transfer(UUID.randomUUID(), ghost, 10, null));
        }

        @Test
        @DisplayName("Self transfers and non-positive amounts are invalid")
        void testInvalidRequests() {
            assertThrows(InvalidRequestException.class, () -> ledgerService.transfer(alice, alice, 10, null));
            assertThrows(InvalidRequestException.class, () -> ledgerService.transfer(alice, bob, 0, null));
            assertThrows(InvalidRequestException.class, () -> ledgerService.transfer(alice, bob, -5, null));
            assertEquals(100, balanceOf(alice));
        }

        @Test
        @DisplayName("Burns debit without a credit side")
        void testBurn() {
            CurrencyTransaction tx = ledgerService.burn(alice, 30, "Shop", TransactionType.PURCHASE);

            assertTrue(tx.isBurn());
            assertEquals(70, balanceOf(alice));
        }
    }

    @Nested
    @DisplayName("Idempotency keys")
    class Idempotency {

        @Test
        @DisplayName("Replaying a key returns the original transaction without moving money again")
        void testReplay() {
            printTestHeader("Idempotent Transfer Replay");
            String key = "transfer-" + UUID.randomUUID();

            CurrencyTransaction first = ledgerService.transfer(alice, bob, 25, "gift", key);
            CurrencyTransaction second = ledgerService.transfer(alice, bob, 25, "gift", key);

            assertEquals(first.getId(), second.getId());
            assertEquals(75, balanceOf(alice));
            assertEquals(25, balanceOf(bob));
            assertEquals(key, ledgerService.findByIdempotencyKey(key).orElseThrow().getIdempotencyKey());
            printSuccess("Second call returned transaction " + second.getId());
        }
    }

    @Test
    @DisplayName("Ledger rows cannot be rewritten")
    void testImmutableLog() {
        CurrencyTransaction tx = ledgerService.transfer(alice, bob, 5, null);

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "UPDATE currency_transactions SET amount = 500 WHERE id = ?", tx.getId()));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
            "DELETE FROM currency_transactions WHERE id = ?", tx.getId()));
    }

    @Test
    @DisplayName("Two concurrent debits of 60 from 100: exactly one succeeds")
    void testConcurrentTransfers() throws Exception {
        printTestHeader("Concurrent Transfers");

        UUID carol = UUID.randomUUID();
        ledgerService.openBalance(carol, gameId, 0);

        int threads = 2;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        UUID[] recipients = {bob, carol};

        for (int i = 0; i < threads; i++) {
            UUID recipient = recipients[i];
            executor.submit(() -> {
                try {
                    start.await();
                    ledgerService.transfer(alice, recipient, 60, "race");
                    succeeded.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    rejected.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        System.out.println("Succeeded: " + succeeded.get() + ", rejected: " + rejected.get());
        assertEquals(1, succeeded.get());
        assertEquals(1, rejected.get());
        assertEquals(40, balanceOf(alice));
        assertEquals(60, balanceOf(bob) + balanceOf(carol));
        assertTrue(balanceOf(alice) >= 0);
        printSuccess("Row lock serialized the debits; no negative balance");
    }

    @Test
    @DisplayName("Opposite-direction transfers between two competitors never deadlock")
    void testOppositeTransfersDoNotDeadlock() throws Exception {
        printTestHeader("Opposite-Direction Transfers");

        UUID dana = UUID.randomUUID();
        UUID erin = UUID.randomUUID();
        ledgerService.openBalance(dana, gameId, 500);
        ledgerService.openBalance(erin, gameId, 500);

        int rounds = 25;
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(2);
        AtomicInteger completed = new AtomicInteger();
        AtomicInteger lockFailures = new AtomicInteger();
        UUID[][] directions = {{dana, erin}, {erin, dana}};

        for (UUID[] direction : directions) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < rounds; i++) {
                        ledgerService.transfer(direction[0], direction[1], 1, "ping-pong");
                        completed.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } catch (DataAccessException e) {
                    lockFailures.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS), "transfers did not finish in time");
        executor.shutdown();

        System.out.println("Completed: " + completed.get() + ", lock failures: " + lockFailures.get());
        assertEquals(0, lockFailures.get());
        assertEquals(2 * rounds, completed.get());
        assertEquals(1000, balanceOf(dana) + balanceOf(erin));
        assertEquals(500, balanceOf(dana));
        assertEquals(500, balanceOf(erin));
        printSuccess("Both directions completed in lock order; total conserved");
    }
}
