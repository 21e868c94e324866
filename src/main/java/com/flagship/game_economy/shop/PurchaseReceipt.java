package com.flagship.game_economy.shop;

import java.time.Instant;
import java.util.UUID;

public record PurchaseReceipt(UUID purchaseId,
                              UUID competitorId,
                              UUID itemId,
                              int quantity,
                              long pricePerUnit,
                              long totalPrice,
                              UUID currencyTransactionId,
                              long balanceAfter,
                              Instant purchasedAt) {
}
