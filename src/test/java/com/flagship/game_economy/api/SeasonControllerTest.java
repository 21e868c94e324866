package com.flagship.game_economy.api;

import com.flagship.game_economy.common.exception.AlreadyPurchasedException;
import com.flagship.game_economy.common.exception.BattlePassRequiredException;
import com.flagship.game_economy.common.exception.SeasonNotFoundException;
import com.flagship.game_economy.common.exception.TierNotReachedException;
import com.flagship.game_economy.season.BattlePass;
import com.flagship.game_economy.season.ProgressionView;
import com.flagship.game_economy.season.RewardType;
import com.flagship.game_economy.season.SeasonProgression;
import com.flagship.game_economy.season.SeasonProgressionService;
import com.flagship.game_economy.season.SeasonTier;
import com.flagship.game_economy.season.XpAwardResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SeasonController.class)
class SeasonControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private SeasonProgressionService seasonService;

    private final UUID seasonId = UUID.randomUUID();
    private final UUID alice = UUID.randomUUID();

    private SeasonProgression progression(int tier, int xp, boolean battlePass) {
        return new SeasonProgression(UUID.randomUUID(), alice, seasonId, tier, xp, battlePass,
                Instant.now(), Instant.now());
    }

    @Test
    @DisplayName("Awarding XP reports every tier crossed")
    void testAwardXp() throws Exception {
        List<SeasonTier> crossed = List.of(
            new SeasonTier(1, 100, RewardType.CURRENCY, 50, null, false),
            new SeasonTier(2, 150, RewardType.CURRENCY, 100, null, false));
        when(seasonService.awardXp(alice, seasonId, 300, "match_win"))
                .thenReturn(new XpAwardResult(progression(2, 50, false), crossed));

        mockMvc.perform(post("/api/seasons/{s}/xp", seasonId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"competitor_id\":\"" + alice + "\",\"amount\":300,\"source\":\"match_win\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.progression.current_tier").value(2))
            .andExpect(jsonPath("$.data.progression.current_xp").value(50))
            .andExpect(jsonPath("$.data.tier_up_rewards.length()").value(2));
    }

    @Test
    @DisplayName("XP awards need a source")
    void testAwardXpValidation() throws Exception {
        mockMvc.perform(post("/api/seasons/{s}/xp", seasonId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"competitor_id\":\"" + alice + "\",\"amount\":300}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.details.source").exists());

        verifyNoInteractions(seasonService);
    }

    @Test
    @DisplayName("Progression read includes reward status")
    void testGetProgression() throws Exception {
        ProgressionView view = new ProgressionView(progression(1, 20, false), 150, List.of(
            new ProgressionView.TierRewardStatus(1, RewardType.CURRENCY, 50, false, true, true),
            new ProgressionView.TierRewardStatus(2, RewardType.ITEM, 1, true, false, false)));
        when(seasonService.getProgression(alice, seasonId)).thenReturn(view);

        mockMvc.perform(get("/api/seasons/{s}/progression/{c}", seasonId, alice))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.next_tier_xp_required").value(150))
            .andExpect(jsonPath("$.data.rewards[0].claimed").value(true))
            .andExpect(jsonPath("$.data.rewards[1].premium").value(true));
    }

    @Test
    @DisplayName("Claim failures keep their codes")
    void testClaimErrors() throws Exception {
        when(seasonService.claimReward(alice, seasonId, 5)).thenThrow(new TierNotReachedException(5, 2));
        when(seasonService.claimReward(alice, seasonId, 2)).thenThrow(new BattlePassRequiredException(2));
        String body = "{\"competitor_id\":\"" + alice + "\"}";

        mockMvc.perform(post("/api/seasons/{s}/rewards/{t}/claim", seasonId, 5)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error.code").value("TIER_NOT_REACHED"));

        mockMvc.perform(post("/api/seasons/{s}/rewards/{t}/claim", seasonId, 2)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error.code").value("BATTLE_PASS_REQUIRED"));
    }

    @Test
    @DisplayName("Battle pass purchase uses the season price when none is given")
    void testBattlePass() throws Exception {
        BattlePass pass = new BattlePass(UUID.randomUUID(), alice, seasonId, 1000, "ACTIVE", Instant.now());
        when(seasonService.purchaseBattlePass(alice, seasonId, null)).thenReturn(pass);

        mockMvc.perform(post("/api/seasons/{s}/battle-pass", seasonId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"competitor_id\":\"" + alice + "\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.price_paid").value(1000));
    }

    @Test
    @DisplayName("A second battle pass is a conflict and an unknown season is not found")
    void testBattlePassErrors() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(seasonService.purchaseBattlePass(alice, seasonId, null)).thenThrow(new AlreadyPurchasedException(alice, seasonId));
        when(seasonService.purchaseBattlePass(alice, unknown, null))
                .thenThrow(new SeasonNotFoundException(unknown));
        String body = "{\"competitor_id\":\"" + alice + "\"}";

        mockMvc.perform(post("/api/seasons/{s}/battle-pass", seasonId)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error.code").value("ALREADY_PURCHASED"));

        mockMvc.perform(post("/api/seasons/{s}/battle-pass", unknown)
                .contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("SEASON_NOT_FOUND"));
    }
}
