package com.flagship.game_economy.observability;

import com.flagship.game_economy.ledger.TransactionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralized metrics for economy operations.
 *
 * Metrics exposed:
 * - economy.transfers: currency movements, tagged by type and outcome
 * - economy.trades: trade offer transitions, tagged by resulting status
 * - economy.season.xp: XP awarded across all seasons
 * - economy.season.tier_ups: tiers crossed by XP awards
 * - economy.season.claims: reward claims, tagged by reward type and outcome
 * - economy.purchases: shop purchases, tagged by outcome
 * - economy.settlement.duration: time spent settling accepted trades
 */
@Component
public class EconomyMetrics {

    private final MeterRegistry registry;

    private final Counter xpAwarded;
    private final Counter tierUps;
    private final Timer settlementTimer;

    public EconomyMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.xpAwarded = Counter.builder("economy.season.xp")
                .description("Total season XP awarded")
                .register(registry);

        this.tierUps = Counter.builder("economy.season.tier_ups")
                .description("Number of tiers crossed by XP awards")
                .register(registry);

        this.settlementTimer = Timer.builder("economy.settlement.duration")
                .description("Time taken to settle an accepted trade")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordTransfer(TransactionType type, String outcome) {
        registry.counter("economy.transfers",
                "type", type.name(),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("economy.idempotency", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("economy.idempotency", "result", "miss").increment();
    }

    // ==================== Trades ====================

    public void recordTrade(String status) {
        registry.counter("economy.trades", "status", sanitizeTag(status)).increment();
    }

    public <T> T timeSettlement(Supplier<T> operation) {
        return settlementTimer.record(operation);
    }

    // ==================== Seasons ====================

    public void recordXpAwarded(long amount, int tiersGained) {
        xpAwarded.increment(amount);
        if (tiersGained > 0) {
            tierUps.increment(tiersGained);
        }
    }

    public void recordClaim(String rewardType, String outcome) {
        registry.counter("economy.season.claims",
                "reward_type", sanitizeTag(rewardType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordBattlePassPurchase() {
        registry.counter("economy.season.battle_passes").increment();
    }

    // ==================== Shop and inventory ====================

    public void recordPurchase(String outcome) {
        registry.counter("economy.purchases", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordItemUsed() {
        registry.counter("economy.items.used").increment();
    }

    public void recordDailyReward() {
        registry.counter("economy.daily_rewards").increment();
    }

    // ==================== Latency ====================

    public void recordLatency(String operation, long durationMs) {
        registry.timer("economy.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Event Processing ====================

    public void recordEventProcessed(String eventType, boolean wasNew) {
        Counter.builder("event.processed")
                .tag("event_type", eventType)
                .tag("was_new", String.valueOf(wasNew))
                .register(registry)
                .increment();
    }

    public void recordEventProcessingFailure(String eventType, String error) {
        Counter.builder("event.processing.failure")
                .tag("event_type", eventType)
                .tag("error", sanitizeTag(error))
                .register(registry)
                .increment();
    }

    /**
     * Limits tag values to a small alphabet to keep cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
