package com.flagship.game_economy.shop;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Purchase log, insert-only. Points at the ledger row that paid for it.
 */
@Entity
@Table(name = "shop_transactions")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ShopTransactionEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "competitor_id", nullable = false, updatable = false)
    private UUID competitorId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "quantity", nullable = false, updatable = false)
    private int quantity;

    @Column(name = "price_per_unit", nullable = false, updatable = false)
    private long pricePerUnit;

    @Column(name = "total_price", nullable = false, updatable = false)
    private long totalPrice;

    @Column(name = "currency_transaction_id", nullable = false, updatable = false)
    private UUID currencyTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
