package com.flagship.game_economy.api;

import com.flagship.game_economy.api.dto.CompetitorRequest;
import com.flagship.game_economy.api.dto.CreateTradeRequest;
import com.flagship.game_economy.api.dto.RespondTradeRequest;
import com.flagship.game_economy.api.dto.TradeResponse;
import com.flagship.game_economy.observability.EconomyMetrics;
import com.flagship.game_economy.trade.TradeOffer;
import com.flagship.game_economy.trade.TradeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/trades")
@RequiredArgsConstructor
@Slf4j
public class TradeController {

    private final TradeService tradeService;
    private final EconomyMetrics metrics;

    @PostMapping
    public ResponseEntity<ApiResponse<TradeResponse>> createOffer(@Valid @RequestBody CreateTradeRequest request) {
        log.info("Received trade offer: from={}, to={}, items={}",
                request.fromCompetitorId(), request.toCompetitorId(),
                request.items() != null ? request.items().size() : 0);

        TradeOffer offer = tradeService.createOffer(
            request.fromCompetitorId(),
            request.toCompetitorId(),
            request.toTradeItems(),
            request.offeredCurrencyOrZero(),
            request.requestedCurrencyOrZero(),
            request.message()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(TradeResponse.from(offer)));
    }

    @GetMapping("/{id}")
    public ApiResponse<TradeResponse> getTrade(@PathVariable("id") UUID id) {
        return ApiResponse.ok(TradeResponse.from(tradeService.getTrade(id)));
    }

    /**
     * Open offers a competitor sent or received.
     */
    @GetMapping
    public ApiResponse<List<TradeResponse>> listPending(@RequestParam("competitorId") UUID competitorId) {
        return ApiResponse.ok(tradeService.listPendingFor(competitorId).stream()
            .map(TradeResponse::from)
            .toList());
    }

    @PostMapping("/{id}/respond")
    public ApiResponse<TradeResponse> respond(@PathVariable("id") UUID id,
                                              @Valid @RequestBody RespondTradeRequest request) {
        long startTime = System.currentTimeMillis();
        try {
            return ApiResponse.ok(TradeResponse.from(
                tradeService.respond(id, request.responderId(), request.accept())));
        } finally {
            metrics.recordLatency("trade_respond", System.currentTimeMillis() - startTime);
        }
    }

    @PostMapping("/{id}/cancel")
    public ApiResponse<TradeResponse> cancel(@PathVariable("id") UUID id,
                                             @Valid @RequestBody CompetitorRequest request) {
        return ApiResponse.ok(TradeResponse.from(tradeService.cancel(id, request.competitorId())));
    }
}
