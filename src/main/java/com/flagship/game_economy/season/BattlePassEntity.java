package com.flagship.game_economy.season;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "battle_passes")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class BattlePassEntity {

    public static final String STATUS_ACTIVE = "ACTIVE";

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "competitor_id", nullable = false, updatable = false)
    private UUID competitorId;

    @Column(name = "season_id", nullable = false, updatable = false)
    private UUID seasonId;

    @Column(name = "price_paid", nullable = false, updatable = false)
    private long pricePaid;

    @Column(name = "status", nullable = false, length = 20)
    private String status;

    @Column(name = "purchased_at", nullable = false, updatable = false)
    private Instant purchasedAt;
}
