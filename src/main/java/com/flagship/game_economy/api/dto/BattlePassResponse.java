package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.season.BattlePass;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BattlePassResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("competitor_id")
    UUID competitorId;

    @JsonProperty("season_id")
    UUID seasonId;

    @JsonProperty("price_paid")
    long pricePaid;

    @JsonProperty("status")
    String status;

    @JsonProperty("purchased_at")
    Instant purchasedAt;

    public static BattlePassResponse from(BattlePass pass) {
        return new BattlePassResponse(pass.id(), pass.competitorId(), pass.seasonId(), pass.pricePaid(),
                pass.status(), pass.purchasedAt());
    }
}
