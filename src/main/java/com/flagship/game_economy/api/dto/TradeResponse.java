package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.trade.TradeOffer;
import com.flagship.game_economy.trade.TradeStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class TradeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("from_competitor_id")
    UUID fromCompetitorId;

    @JsonProperty("to_competitor_id")
    UUID toCompetitorId;

    @JsonProperty("status")
    TradeStatus status;

    @JsonProperty("offered_currency")
    long offeredCurrency;

    @JsonProperty("requested_currency")
    long requestedCurrency;

    @JsonProperty("message")
    String message;

    @JsonProperty("items")
    List<Item> items;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @Value
    public static class Item {
        @JsonProperty("item_id")
        UUID itemId;

        @JsonProperty("quantity")
        int quantity;

        @JsonProperty("from_competitor")
        boolean fromCompetitor;
    }

    public static TradeResponse from(TradeOffer offer) {
        return TradeResponse.builder()
            .id(offer.getId())
            .fromCompetitorId(offer.getFromCompetitorId())
            .toCompetitorId(offer.getToCompetitorId())
            .status(offer.getStatus())
            .offeredCurrency(offer.getOfferedCurrency())
            .requestedCurrency(offer.getRequestedCurrency())
            .message(offer.getMessage())
            .items(offer.getItems().stream()
                .map(item -> new Item(item.getItemId(), item.getQuantity(), item.isFromCompetitor()))
                .toList())
            .expiresAt(offer.getExpiresAt())
            .createdAt(offer.getCreatedAt())
            .completedAt(offer.getCompletedAt())
            .build();
    }
}
