package com.flagship.game_economy.reward;

import com.flagship.game_economy.common.exception.AlreadyClaimedException;
import com.flagship.game_economy.config.EconomyProperties;
import com.flagship.game_economy.ledger.CurrencyTransaction;
import com.flagship.game_economy.ledger.LedgerService;
import com.flagship.game_economy.ledger.TransactionType;
import com.flagship.game_economy.observability.EconomyMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Once-per-day currency bonus. Days are UTC calendar days.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DailyRewardService {

    private final DailyRewardClaimRepository claimRepository;
    private final LedgerService ledgerService;
    private final EconomyProperties properties;
    private final EconomyMetrics metrics;
    private final Clock clock;

    /**
     * @throws AlreadyClaimedException on the second claim of the same day
     */
    @Transactional
    public DailyReward claim(UUID competitorId) {
        Instant now = clock.instant();
        LocalDate today = LocalDate.ofInstant(now, ZoneOffset.UTC);
        long amount = properties.dailyReward().amount();

        if (claimRepository.existsByCompetitorIdAndRewardDate(competitorId, today)) {
            throw new AlreadyClaimedException("Daily reward for " + today + " has already been claimed");
        }

        DailyRewardClaimEntity claim;
        try {
            claim = claimRepository.saveAndFlush(
                    new DailyRewardClaimEntity(UUID.randomUUID(), competitorId, today, amount, now));
        } catch (DataIntegrityViolationException e) {
            // A concurrent claim for the same day committed first
            throw new AlreadyClaimedException("Daily reward for " + today + " has already been claimed");
        }

        CurrencyTransaction transaction = ledgerService.mint(competitorId, amount, "Daily reward " + today,
                TransactionType.REWARD);
        long balanceAfter = ledgerService.getBalance(competitorId).getBalance();

        metrics.recordDailyReward();
        log.info("Daily reward claimed: competitor={}, date={}, amount={}", competitorId, today, amount);
        return new DailyReward(claim.getId(), competitorId, today, amount, transaction.getId(), balanceAfter);
    }
}
