package com.flagship.game_economy.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Typed settings for the economy engine, bound from the {@code economy.*} namespace.
 */
@ConfigurationProperties(prefix = "economy")
public record EconomyProperties(
        @DefaultValue Trade trade,
        @DefaultValue Season season,
        @DefaultValue DailyReward dailyReward
) {

    public record Trade(
            @DefaultValue("24h") Duration offerTtl,
            @DefaultValue Expiry expiry
    ) {}

    /**
     * Background sweep that marks stale PENDING offers EXPIRED.
     * Expiry is enforced at read time regardless of this sweep.
     */
    public record Expiry(
            @DefaultValue("false") boolean sweepEnabled,
            @DefaultValue("60000") long sweepIntervalMs,
            @DefaultValue("200") int batchSize
    ) {}

    public record Season(
            @DefaultValue("1000") long defaultBattlePassPrice
    ) {}

    public record DailyReward(
            @DefaultValue("50") long amount
    ) {}
}
