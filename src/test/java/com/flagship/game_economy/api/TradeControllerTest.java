package com.flagship.game_economy.api;

import com.flagship.game_economy.common.exception.InvalidTradeException;
import com.flagship.game_economy.common.exception.TradeNotFoundException;
import com.flagship.game_economy.observability.EconomyMetrics;
import com.flagship.game_economy.trade.TradeItem;
import com.flagship.game_economy.trade.TradeOffer;
import com.flagship.game_economy.trade.TradeService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TradeController.class)
class TradeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TradeService tradeService;

    @MockBean
    private EconomyMetrics metrics;

    private final UUID alice = UUID.randomUUID();
    private final UUID bob = UUID.randomUUID();
    private final UUID sword = UUID.randomUUID();

    private TradeOffer offer() {
        return TradeOffer.create(alice, bob, List.of(new TradeItem(sword, 1, true)), 0, 25, "deal?",
                Duration.ofHours(24));
    }

    @Test
    @DisplayName("Creating an offer returns it as PENDING")
    void testCreate() throws Exception {
        TradeOffer offer = offer();
        when(tradeService.createOffer(eq(alice), eq(bob), anyList(), eq(0L), eq(25L), eq("deal?"))).thenReturn(offer);

        mockMvc.perform(post("/api/trades")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"from_competitor_id":"%s","to_competitor_id":"%s",
                     "items":[{"item_id":"%s","quantity":1,"from_competitor":true}],
                     "requested_currency":25,"message":"deal?"}
                    """.formatted(alice, bob, sword)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.status").value("PENDING"))
            .andExpect(jsonPath("$.data.items[0].item_id").value(sword.toString()))
            .andExpect(jsonPath("$.data.requested_currency").value(25));
    }

    @Test
    @DisplayName("Item lines need a positive quantity")
    void testInvalidItemLine() throws Exception {
        mockMvc.perform(post("/api/trades")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"from_competitor_id":"%s","to_competitor_id":"%s",
                     "items":[{"item_id":"%s","quantity":0,"from_competitor":true}]}
                    """.formatted(alice, bob, sword)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("VALIDATION_FAILED"));

        verifyNoInteractions(tradeService);
    }

    @Test
    @DisplayName("A null item line is a validation failure")
    void testNullItemLine() throws Exception {
        mockMvc.perform(post("/api/trades")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"from_competitor_id":"%s","to_competitor_id":"%s",
                     "items":[{"item_id":"%s","quantity":1,"from_competitor":true}, null]}
                    """.formatted(alice, bob, sword)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("VALIDATION_FAILED"));

        verifyNoInteractions(tradeService);
    }

    @Test
    @DisplayName("Unknown trades map to 404")
    void testNotFound() throws Exception {
        UUID id = UUID.randomUUID();
        when(tradeService.getTrade(id)).thenThrow(new TradeNotFoundException(id));

        mockMvc.perform(get("/api/trades/{id}", id))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("TRADE_NOT_FOUND"));
    }

    @Test
    @DisplayName("Accepting a resolved trade is a conflict")
    void testRespondConflict() throws Exception {
        UUID id = UUID.randomUUID();
        when(tradeService.respond(id, bob, true)).thenThrow(new InvalidTradeException("Trade is already COMPLETED"));

        mockMvc.perform(post("/api/trades/{id}/respond", id)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"responder_id\":\"" + bob + "\",\"accept\":true}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error.code").value("INVALID_TRADE"));
    }

    @Test
    @DisplayName("Accepting returns the completed trade")
    void testAccept() throws Exception {
        TradeOffer completed = offer().complete();
        when(tradeService.respond(completed.getId(), bob, true)).thenReturn(completed);

        mockMvc.perform(post("/api/trades/{id}/respond", completed.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"responder_id\":\"" + bob + "\",\"accept\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("COMPLETED"))
            .andExpect(jsonPath("$.data.completed_at").exists());
    }

    @Test
    @DisplayName("Cancelling returns the cancelled trade")
    void testCancel() throws Exception {
        TradeOffer cancelled = offer().cancel();
        when(tradeService.cancel(cancelled.getId(), alice)).thenReturn(cancelled);

        mockMvc.perform(post("/api/trades/{id}/cancel", cancelled.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"competitor_id\":\"" + alice + "\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("CANCELLED"));
    }
}
