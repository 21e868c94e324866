package com.flagship.game_economy.trade;

import com.flagship.game_economy.common.exception.InsufficientFundsException;
import com.flagship.game_economy.common.exception.InsufficientQuantityException;
import com.flagship.game_economy.common.exception.InvalidTradeException;
import com.flagship.game_economy.common.exception.TradeNotFoundException;
import com.flagship.game_economy.config.EconomyProperties;
import com.flagship.game_economy.inventory.InventoryEntry;
import com.flagship.game_economy.inventory.InventoryKey;
import com.flagship.game_economy.inventory.InventoryStore;
import com.flagship.game_economy.ledger.LedgerService;
import com.flagship.game_economy.observability.EconomyMetrics;
import com.flagship.game_economy.outbox.OutboxService;
import com.flagship.game_economy.trade.event.TradeResolvedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Rejection paths of the trade engine, checked without a database: every one of them
 * must fail before settlement or any write is attempted.
 */
@ExtendWith(MockitoExtension.class)
class TradeServiceValidationTest {

    @Mock
    private TradeOfferRepository tradeOfferRepository;

    @Mock
    private InventoryStore inventoryStore;

    @Mock
    private LedgerService ledgerService;

    @Mock
    private TradeSettlement tradeSettlement;

    @Mock
    private OutboxService outboxService;

    @Mock
    private EconomyMetrics metrics;

    private TradeService tradeService;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final UUID sword = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        EconomyProperties properties = new EconomyProperties(
            new EconomyProperties.Trade(Duration.ofHours(24), new EconomyProperties.Expiry(false, 60_000, 200)),
            new EconomyProperties.Season(1000),
            new EconomyProperties.DailyReward(50)
        );
        tradeService = new TradeService(tradeOfferRepository, inventoryStore, ledgerService, tradeSettlement,
                outboxService, properties, metrics);
    }

    private TradeOffer pendingOffer(Instant expiresAt) {
        return new TradeOffer(UUID.randomUUID(), alice, bob, TradeStatus.PENDING, 0, 0, null,
                List.of(new TradeItem(sword, 1, true)), expiresAt, Instant.now().minusSeconds(60), null);
    }

    private TradeOfferEntity stored(TradeOffer offer) {
        TradeOfferEntity entity = TradeOfferEntity.fromDomain(offer);
        when(tradeOfferRepository.findByIdForUpdate(offer.getId())).thenReturn(Optional.of(entity));
        return entity;
    }

    @Nested
    @DisplayName("createOffer")
    class CreateOffer {

        @Test
        @DisplayName("A competitor cannot trade with themselves")
        void testSelfTrade() {
            assertThrows(InvalidTradeException.class, () -> tradeService.createOffer(
                    alice, alice, List.of(new TradeItem(sword, 1, true)), 0, 0, null));
            verifyNoInteractions(inventoryStore, tradeOfferRepository, outboxService);
        }

        @Test
        @DisplayName("An offer with nothing in it is rejected")
        void testEmptyOffer() {
            assertThrows(InvalidTradeException.class,
                    () -> tradeService.createOffer(alice, bob, List.of(), 0, 0, null));
        }

        @Test
        @DisplayName("Duplicate lines of one item are summed before the holdings check")
        void testAggregatedQuantityCheck() {
            InventoryEntry twoSwords = new InventoryEntry(UUID.randomUUID(), alice, sword, 2, 0, Instant.now(), null);
            when(inventoryStore.lockAll(anyCollection()))
                    .thenReturn(Map.of(new InventoryKey(alice, sword), twoSwords));

            InsufficientQuantityException e = assertThrows(InsufficientQuantityException.class,
                    () -> tradeService.createOffer(alice, bob,
                            List.of(new TradeItem(sword, 2, true), new TradeItem(sword, 1, true)), 0, 0, null));

            assertTrue(e.getMessage().contains(sword.toString()));
            verify(tradeOfferRepository, never()).save(any());
        }

        @Test
        @DisplayName("Offered currency above the balance is rejected")
        void testInsufficientCurrency() {
            when(ledgerService.findBalance(alice)).thenReturn(Optional.empty());

            assertThrows(InsufficientFundsException.class,
                    () -> tradeService.createOffer(alice, bob, List.of(), 50, 0, null));
            verify(tradeOfferRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("respond")
    class Respond {

        @Test
        @DisplayName("Unknown trades are reported as not found")
        void testUnknownTrade() {
            UUID missing = UUID.randomUUID();
            when(tradeOfferRepository.findByIdForUpdate(missing)).thenReturn(Optional.empty());

            assertThrows(TradeNotFoundException.class, () -> tradeService.respond(missing, bob, true));
        }

        @Test
        @DisplayName("Only the recipient may respond")
        void testWrongResponder() {
            TradeOffer offer = pendingOffer(Instant.now().plusSeconds(3600));
            stored(offer);

            assertThrows(InvalidTradeException.class, () -> tradeService.respond(offer.getId(), alice, true));
            verifyNoInteractions(tradeSettlement);
        }

        @Test
        @DisplayName("An expired offer cannot be accepted")
        void testExpiredOffer() {
            TradeOffer offer = pendingOffer(Instant.now().minusSeconds(1));
            stored(offer);

            assertThrows(InvalidTradeException.class, () -> tradeService.respond(offer.getId(), bob, true));
            verifyNoInteractions(tradeSettlement, outboxService);
        }

        @Test
        @DisplayName("A resolved offer cannot be answered again")
        void testTerminalOffer() {
            TradeOffer offer = pendingOffer(Instant.now().plusSeconds(3600)).reject();
            stored(offer);

            assertThrows(InvalidTradeException.class, () -> tradeService.respond(offer.getId(), bob, true));
            verifyNoInteractions(tradeSettlement);
        }

        @Test
        @DisplayName("Rejecting moves nothing and records the outcome")
        void testReject() {
            TradeOffer offer = pendingOffer(Instant.now().plusSeconds(3600));
            stored(offer);

            TradeOffer resolved = tradeService.respond(offer.getId(), bob, false);

            assertEquals(TradeStatus.REJECTED, resolved.getStatus());
            verifyNoInteractions(tradeSettlement);
            verify(outboxService).saveEvent(any(TradeResolvedEvent.class));
        }
    }

    @Nested
    @DisplayName("cancel")
    class Cancel {

        @Test
        @DisplayName("Only the offering competitor may cancel")
        void testRecipientCannotCancel() {
            TradeOffer offer = pendingOffer(Instant.now().plusSeconds(3600));
            stored(offer);

            assertThrows(InvalidTradeException.class, () -> tradeService.cancel(offer.getId(), bob));
        }

        @Test
        @DisplayName("The offering competitor can withdraw a pending offer")
        void testCancel() {
            TradeOffer offer = pendingOffer(Instant.now().plusSeconds(3600));
            stored(offer);

            assertEquals(TradeStatus.CANCELLED, tradeService.cancel(offer.getId(), alice).getStatus());
        }
    }
}
