package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

/**
 * Body naming the acting competitor, for calls that need nothing else.
 */
public record CompetitorRequest(
        @NotNull(message = "Competitor is required")
        @JsonProperty("competitor_id")
        UUID competitorId
) {
}
