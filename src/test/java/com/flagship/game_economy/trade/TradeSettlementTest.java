package com.flagship.game_economy.trade;

import com.flagship.game_economy.common.exception.InsufficientFundsException;
import com.flagship.game_economy.common.exception.RecipientNotFoundException;
import com.flagship.game_economy.inventory.InventoryEntry;
import com.flagship.game_economy.inventory.InventoryKey;
import com.flagship.game_economy.inventory.InventoryStore;
import com.flagship.game_economy.ledger.CurrencyBalance;
import com.flagship.game_economy.ledger.LedgerService;
import com.flagship.game_economy.ledger.TransactionType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Settlement must reject short currency legs while the inventory is still untouched.
 */
@ExtendWith(MockitoExtension.class)
class TradeSettlementTest {

    @Mock
    private InventoryStore inventoryStore;

    @Mock
    private LedgerService ledgerService;

    private TradeSettlement settlement;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final UUID sword = UUID.randomUUID();
    private final UUID shield = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        settlement = new TradeSettlement(inventoryStore, ledgerService);
    }

    private TradeOffer offer(long offeredCurrency, long requestedCurrency) {
        return new TradeOffer(UUID.randomUUID(), alice, bob, TradeStatus.PENDING, offeredCurrency, requestedCurrency,
                null, List.of(new TradeItem(sword, 1, true), new TradeItem(shield, 1, false)),
                Instant.now().plusSeconds(3600), Instant.now(), null);
    }

    private void holdingsAvailable() {
        when(inventoryStore.lockAll(anyCollection())).thenReturn(Map.of(
            new InventoryKey(alice, sword), new InventoryEntry(UUID.randomUUID(), alice, sword, 1, 0, Instant.now(), null),
            new InventoryKey(bob, shield), new InventoryEntry(UUID.randomUUID(), bob, shield, 1, 0, Instant.now(), null)
        ));
    }

    private CurrencyBalance balance(UUID competitorId, long amount) {
        return new CurrencyBalance(UUID.randomUUID(), competitorId, UUID.randomUUID(), amount, Instant.now());
    }

    @Test
    @DisplayName("A recipient short of the requested currency fails before any item moves")
    void testRequestedCurrencyShort() {
        holdingsAvailable();
        when(ledgerService.lockBalances(alice, bob)).thenReturn(Map.of(
            alice, balance(alice, 500),
            bob, balance(bob, 100)
        ));

        InsufficientFundsException ex = assertThrows(InsufficientFundsException.class,
                () -> settlement.settle(offer(0, 150)));

        assertEquals(bob, ex.getCompetitorId());
        assertEquals(100, ex.getAvailable());
        verify(inventoryStore, never()).decrement(any(), any(), anyInt());
        verify(inventoryStore, never()).increment(any(), any(), anyInt(), any());
        verify(ledgerService, never()).transferTyped(any(), any(), anyLong(), anyString(), any());
    }

    @Test
    @DisplayName("Offered currency to a competitor without a balance fails before any item moves")
    void testRecipientWithoutBalance() {
        holdingsAvailable();
        when(ledgerService.lockBalances(alice, bob)).thenReturn(Map.of(alice, balance(alice, 500)));

        assertThrows(RecipientNotFoundException.class, () -> settlement.settle(offer(50, 0)));

        verify(inventoryStore, never()).decrement(any(), any(), anyInt());
        verify(inventoryStore, never()).increment(any(), any(), anyInt(), any());
    }

    @Test
    @DisplayName("The requested leg may be paid out of the offered leg")
    void testRequestedPaidFromOffered() {
        holdingsAvailable();
        when(ledgerService.lockBalances(alice, bob)).thenReturn(Map.of(
            alice, balance(alice, 50),
            bob, balance(bob, 100)
        ));
        when(inventoryStore.decrement(any(), any(), anyInt())).thenReturn(true);

        settlement.settle(offer(50, 120));

        verify(inventoryStore).decrement(alice, sword, 1);
        verify(inventoryStore).decrement(bob, shield, 1);
        verify(ledgerService).transferTyped(eq(alice), eq(bob), eq(50L), anyString(), eq(TransactionType.TRADE));
        verify(ledgerService).transferTyped(eq(bob), eq(alice), eq(120L), anyString(), eq(TransactionType.TRADE));
    }
}
