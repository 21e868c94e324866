package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record AwardXpRequest(
        @NotNull(message = "Competitor is required")
        @JsonProperty("competitor_id")
        UUID competitorId,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be greater than 0")
        @JsonProperty("amount")
        Integer amount,

        @NotBlank(message = "Source is required")
        @Size(max = 64, message = "Source must be at most 64 characters")
        @JsonProperty("source")
        String source
) {
}
