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

/**
 * One row per XP award, insert-only.
 */
@Entity
@Table(name = "season_xp_history")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SeasonXpHistoryEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "competitor_id", nullable = false, updatable = false)
    private UUID competitorId;

    @Column(name = "season_id", nullable = false, updatable = false)
    private UUID seasonId;

    @Column(name = "amount", nullable = false, updatable = false)
    private int amount;

    @Column(name = "source", nullable = false, updatable = false, length = 100)
    private String source;

    @Column(name = "tier_before", nullable = false, updatable = false)
    private int tierBefore;

    @Column(name = "tier_after", nullable = false, updatable = false)
    private int tierAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
}
