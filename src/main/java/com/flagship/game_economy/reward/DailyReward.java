package com.flagship.game_economy.reward;

import java.time.LocalDate;
import java.util.UUID;

public record DailyReward(UUID claimId,
                          UUID competitorId,
                          LocalDate rewardDate,
                          long amount,
                          UUID currencyTransactionId,
                          long balanceAfter) {
}
