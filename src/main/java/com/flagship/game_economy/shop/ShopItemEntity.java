package com.flagship.game_economy.shop;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Shop catalog row. Only {@code stock} changes at runtime.
 */
@Entity
@Table(name = "shop_items")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ShopItemEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "game_id", nullable = false, updatable = false)
    private UUID gameId;

    @Column(name = "name", nullable = false, updatable = false)
    private String name;

    @Column(name = "price", nullable = false, updatable = false)
    private long price;

    // null means unlimited
    @Column(name = "stock")
    private Integer stock;

    @Column(name = "available", nullable = false, updatable = false)
    private boolean available;

    @Column(name = "rarity", length = 50, updatable = false)
    private String rarity;

    public boolean hasStockFor(int quantity) {
        return stock == null || stock >= quantity;
    }

    public void takeStock(int quantity) {
        if (stock != null) {
            stock = stock - quantity;
        }
    }
}
