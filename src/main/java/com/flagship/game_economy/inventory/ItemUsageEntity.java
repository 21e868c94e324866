package com.flagship.game_economy.inventory;

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
 * Append-only log of item consumption.
 */
@Entity
@Table(name = "item_usages")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ItemUsageEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "competitor_id", nullable = false, updatable = false)
    private UUID competitorId;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "quantity", nullable = false, updatable = false)
    private int quantity;

    @Column(name = "used_at", nullable = false, updatable = false)
    private Instant usedAt;
}
