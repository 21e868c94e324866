package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.UUID;

/**
 * {@code price} is optional; the season's price, then the configured default, apply when absent.
 */
public record BattlePassRequest(
        @NotNull(message = "Competitor is required")
        @JsonProperty("competitor_id")
        UUID competitorId,

        @Positive(message = "Price must be greater than 0")
        @JsonProperty("price")
        Long price
) {
}
