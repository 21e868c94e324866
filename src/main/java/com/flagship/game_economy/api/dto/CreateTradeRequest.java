package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.trade.TradeItem;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

public record CreateTradeRequest(
        @NotNull(message = "Offering competitor is required")
        @JsonProperty("from_competitor_id")
        UUID fromCompetitorId,

        @NotNull(message = "Recipient is required")
        @JsonProperty("to_competitor_id")
        UUID toCompetitorId,

        @Valid
        @JsonProperty("items")
        List<@NotNull(message = "Trade item is required") @Valid Item> items,

        @PositiveOrZero(message = "Offered currency cannot be negative")
        @JsonProperty("offered_currency")
        Long offeredCurrency,

        @PositiveOrZero(message = "Requested currency cannot be negative")
        @JsonProperty("requested_currency")
        Long requestedCurrency,

        @Size(max = 500, message = "Message must be at most 500 characters")
        @JsonProperty("message")
        String message
) {

    public record Item(
            @NotNull(message = "Item is required")
            @JsonProperty("item_id")
            UUID itemId,

            @NotNull(message = "Quantity is required")
            @Positive(message = "Quantity must be greater than 0")
            @JsonProperty("quantity")
            Integer quantity,

            @JsonProperty("from_competitor")
            boolean fromCompetitor
    ) {
    }

    public List<TradeItem> toTradeItems() {
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .map(item -> new TradeItem(item.itemId(), item.quantity(), item.fromCompetitor()))
                .toList();
    }

    public long offeredCurrencyOrZero() {
        return offeredCurrency != null ? offeredCurrency : 0L;
    }

    public long requestedCurrencyOrZero() {
        return requestedCurrency != null ? requestedCurrency : 0L;
    }
}
