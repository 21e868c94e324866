package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.UUID;

public record TransferRequest(
        @NotNull(message = "Sender is required")
        @JsonProperty("from_competitor_id")
        UUID fromCompetitorId,

        @NotNull(message = "Recipient is required")
        @JsonProperty("to_competitor_id")
        UUID toCompetitorId,

        @NotNull(message = "Amount is required")
        @Positive(message = "Amount must be greater than 0")
        @JsonProperty("amount")
        Long amount,

        @Size(max = 255, message = "Reason must be at most 255 characters")
        @JsonProperty("reason")
        String reason
) {
}
