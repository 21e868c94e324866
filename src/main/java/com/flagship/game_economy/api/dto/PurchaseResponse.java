package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.shop.PurchaseReceipt;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PurchaseResponse {

    @JsonProperty("purchase_id")
    UUID purchaseId;

    @JsonProperty("item_id")
    UUID itemId;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("price_per_unit")
    long pricePerUnit;

    @JsonProperty("total_price")
    long totalPrice;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("balance_after")
    long balanceAfter;

    @JsonProperty("purchased_at")
    Instant purchasedAt;

    public static PurchaseResponse from(PurchaseReceipt receipt) {
        return PurchaseResponse.builder()
            .purchaseId(receipt.purchaseId())
            .itemId(receipt.itemId())
            .quantity(receipt.quantity())
            .pricePerUnit(receipt.pricePerUnit())
            .totalPrice(receipt.totalPrice())
            .transactionId(receipt.currencyTransactionId())
            .balanceAfter(receipt.balanceAfter())
            .purchasedAt(receipt.purchasedAt())
            .build();
    }
}
