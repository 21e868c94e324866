package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.UUID;

/**
 * Body of item use and shop purchase calls.
 */
public record QuantityRequest(
        @NotNull(message = "Competitor is required")
        @JsonProperty("competitor_id")
        UUID competitorId,

        @NotNull(message = "Quantity is required")
        @Positive(message = "Quantity must be greater than 0")
        @JsonProperty("quantity")
        Integer quantity
) {
}
