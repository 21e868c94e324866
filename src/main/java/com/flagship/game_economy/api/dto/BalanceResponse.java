package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.ledger.CurrencyBalance;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BalanceResponse {

    @JsonProperty("competitor_id")
    UUID competitorId;

    @JsonProperty("game_id")
    UUID gameId;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static BalanceResponse from(CurrencyBalance balance) {
        return new BalanceResponse(balance.getCompetitorId(), balance.getGameId(), balance.getBalance(),
                balance.getUpdatedAt());
    }
}
