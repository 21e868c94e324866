package com.flagship.game_economy.api;

import com.flagship.game_economy.api.dto.AwardXpRequest;
import com.flagship.game_economy.api.dto.BattlePassRequest;
import com.flagship.game_economy.api.dto.BattlePassResponse;
import com.flagship.game_economy.api.dto.ClaimedRewardResponse;
import com.flagship.game_economy.api.dto.CompetitorRequest;
import com.flagship.game_economy.api.dto.ProgressionResponse;
import com.flagship.game_economy.api.dto.XpAwardResponse;
import com.flagship.game_economy.observability.CorrelationContext;
import com.flagship.game_economy.season.SeasonProgressionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/seasons/{seasonId}")
@RequiredArgsConstructor
public class SeasonController {

    private final SeasonProgressionService seasonService;

    @PostMapping("/xp")
    public ApiResponse<XpAwardResponse> awardXp(@PathVariable("seasonId") UUID seasonId,
                                                @Valid @RequestBody AwardXpRequest request) {
        MDC.put(CorrelationContext.COMPETITOR_ID_MDC_KEY, request.competitorId().toString());
        try {
            return ApiResponse.ok(XpAwardResponse.from(
                seasonService.awardXp(request.competitorId(), seasonId, request.amount(), request.source())));
        } finally {
            MDC.remove(CorrelationContext.COMPETITOR_ID_MDC_KEY);
        }
    }

    @GetMapping("/progression/{competitorId}")
    public ApiResponse<ProgressionResponse> getProgression(@PathVariable("seasonId") UUID seasonId,
                                                           @PathVariable("competitorId") UUID competitorId) {
        return ApiResponse.ok(ProgressionResponse.from(seasonService.getProgression(competitorId, seasonId)));
    }

    @PostMapping("/rewards/{tierNumber}/claim")
    public ApiResponse<ClaimedRewardResponse> claimReward(@PathVariable("seasonId") UUID seasonId,
                                                          @PathVariable("tierNumber") int tierNumber,
                                                          @Valid @RequestBody CompetitorRequest request) {
        MDC.put(CorrelationContext.COMPETITOR_ID_MDC_KEY, request.competitorId().toString());
        try {
            return ApiResponse.ok(ClaimedRewardResponse.from(
                seasonService.claimReward(request.competitorId(), seasonId, tierNumber)));
        } finally {
            MDC.remove(CorrelationContext.COMPETITOR_ID_MDC_KEY);
        }
    }

    @PostMapping("/battle-pass")
    public ResponseEntity<ApiResponse<BattlePassResponse>> purchaseBattlePass(
            @PathVariable("seasonId") UUID seasonId,
            @Valid @RequestBody BattlePassRequest request) {
        MDC.put(CorrelationContext.COMPETITOR_ID_MDC_KEY, request.competitorId().toString());
        try {
            BattlePassResponse pass = BattlePassResponse.from(
                seasonService.purchaseBattlePass(request.competitorId(), seasonId, request.price()));
            return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(pass));
        } finally {
            MDC.remove(CorrelationContext.COMPETITOR_ID_MDC_KEY);
        }
    }
}
