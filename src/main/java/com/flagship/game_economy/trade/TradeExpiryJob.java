package com.flagship.game_economy.trade;

import com.flagship.game_economy.config.EconomyProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Marks stale PENDING offers EXPIRED so that listings and counts stay accurate.
 * Expiry is already enforced when an offer is answered; this only tidies status.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "economy.trade.expiry.sweep-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class TradeExpiryJob {

    private final TradeService tradeService;
    private final EconomyProperties properties;

    @Scheduled(fixedDelayString = "${economy.trade.expiry.sweep-interval-ms:60000}")
    public void sweep() {
        int batchSize = properties.trade().expiry().batchSize();
        try {
            int expired;
            do {
                expired = tradeService.expireStaleOffers(batchSize);
            } while (expired == batchSize);
        } catch (RuntimeException e) {
            log.error("Trade expiry sweep failed", e);
        }
    }
}
