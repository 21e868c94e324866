package com.flagship.game_economy.api;

import com.flagship.game_economy.api.dto.BalanceResponse;
import com.flagship.game_economy.api.dto.CompetitorRequest;
import com.flagship.game_economy.api.dto.DailyRewardResponse;
import com.flagship.game_economy.api.dto.InventoryEntryResponse;
import com.flagship.game_economy.api.dto.PurchaseResponse;
import com.flagship.game_economy.api.dto.QuantityRequest;
import com.flagship.game_economy.api.dto.TransactionResponse;
import com.flagship.game_economy.api.dto.TransferRequest;
import com.flagship.game_economy.inventory.InventoryService;
import com.flagship.game_economy.ledger.CurrencyTransaction;
import com.flagship.game_economy.ledger.LedgerService;
import com.flagship.game_economy.observability.CorrelationContext;
import com.flagship.game_economy.observability.EconomyMetrics;
import com.flagship.game_economy.reward.DailyRewardService;
import com.flagship.game_economy.shop.ShopService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Currency, inventory, shop and daily reward endpoints.
 *
 * Transfers accept an optional Idempotency-Key header: a repeated key returns the
 * transaction recorded the first time instead of moving currency again.
 */
@RestController
@RequestMapping("/api/economy")
@RequiredArgsConstructor
@Slf4j
public class EconomyController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final int DEFAULT_HISTORY_LIMIT = 50;
    private static final int MAX_HISTORY_LIMIT = 200;

    private final LedgerService ledgerService;
    private final InventoryService inventoryService;
    private final ShopService shopService;
    private final DailyRewardService dailyRewardService;
    private final EconomyMetrics metrics;

    @PostMapping("/transfers")
    public ResponseEntity<ApiResponse<TransactionResponse>> transfer(
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.COMPETITOR_ID_MDC_KEY, request.fromCompetitorId().toString());

        log.info("Received transfer request: from={}, to={}, amount={}, idempotencyKey={}",
                request.fromCompetitorId(), request.toCompetitorId(), request.amount(), idempotencyKey);

        try {
            CurrencyTransaction transaction = ledgerService.transfer(
                request.fromCompetitorId(),
                request.toCompetitorId(),
                request.amount(),
                request.reason(),
                idempotencyKey
            );

            return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(TransactionResponse.from(transaction)));
        } finally {
            metrics.recordLatency("transfer", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.COMPETITOR_ID_MDC_KEY);
        }
    }

    @GetMapping("/balances/{competitorId}")
    public ApiResponse<BalanceResponse> getBalance(@PathVariable("competitorId") UUID competitorId) {
        return ApiResponse.ok(BalanceResponse.from(ledgerService.getBalance(competitorId)));
    }

    @GetMapping("/balances/{competitorId}/history")
    public ApiResponse<List<TransactionResponse>> getHistory(
            @PathVariable("competitorId") UUID competitorId,
            @RequestParam(value = "limit", defaultValue = "" + DEFAULT_HISTORY_LIMIT) int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return ApiResponse.ok(ledgerService.getHistory(competitorId, bounded).stream()
            .map(TransactionResponse::from)
            .toList());
    }

    @GetMapping("/inventory/{competitorId}")
    public ApiResponse<List<InventoryEntryResponse>> getInventory(@PathVariable("competitorId") UUID competitorId) {
        return ApiResponse.ok(inventoryService.getInventory(competitorId).stream()
            .map(InventoryEntryResponse::from)
            .toList());
    }

    @PostMapping("/inventory/{competitorId}/items/{itemId}/use")
    public ApiResponse<InventoryEntryResponse> useItem(
            @PathVariable("competitorId") UUID competitorId,
            @PathVariable("itemId") UUID itemId,
            @RequestParam(value = "quantity", defaultValue = "1") int quantity) {
        MDC.put(CorrelationContext.COMPETITOR_ID_MDC_KEY, competitorId.toString());
        try {
            return ApiResponse.ok(InventoryEntryResponse.from(inventoryService.useItem(competitorId, itemId, quantity)));
        } finally {
            MDC.remove(CorrelationContext.COMPETITOR_ID_MDC_KEY);
        }
    }

    @PostMapping("/shop/items/{itemId}/purchase")
    public ResponseEntity<ApiResponse<PurchaseResponse>> purchaseItem(
            @PathVariable("itemId") UUID itemId,
            @Valid @RequestBody QuantityRequest request) {

        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.COMPETITOR_ID_MDC_KEY, request.competitorId().toString());
        try {
            PurchaseResponse receipt = PurchaseResponse.from(
                shopService.purchaseItem(request.competitorId(), itemId, request.quantity()));
            return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(receipt));
        } finally {
            metrics.recordLatency("purchase", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.COMPETITOR_ID_MDC_KEY);
        }
    }

    @PostMapping("/rewards/daily")
    public ApiResponse<DailyRewardResponse> claimDailyReward(@Valid @RequestBody CompetitorRequest request) {
        MDC.put(CorrelationContext.COMPETITOR_ID_MDC_KEY, request.competitorId().toString());
        try {
            return ApiResponse.ok(DailyRewardResponse.from(dailyRewardService.claim(request.competitorId())));
        } finally {
            MDC.remove(CorrelationContext.COMPETITOR_ID_MDC_KEY);
        }
    }
}
