package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.reward.DailyReward;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
public class DailyRewardResponse {

    @JsonProperty("reward_date")
    LocalDate rewardDate;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("balance_after")
    long balanceAfter;

    public static DailyRewardResponse from(DailyReward reward) {
        return new DailyRewardResponse(reward.rewardDate(), reward.amount(), reward.currencyTransactionId(),
                reward.balanceAfter());
    }
}
