package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record RespondTradeRequest(
        @NotNull(message = "Responder is required")
        @JsonProperty("responder_id")
        UUID responderId,

        @NotNull(message = "Accept flag is required")
        @JsonProperty("accept")
        Boolean accept
) {
}
