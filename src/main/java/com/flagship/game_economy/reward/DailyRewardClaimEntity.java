package com.flagship.game_economy.reward;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "daily_reward_claims")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DailyRewardClaimEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "competitor_id", nullable = false, updatable = false)
    private UUID competitorId;

    // UTC calendar day
    @Column(name = "reward_date", nullable = false, updatable = false)
    private LocalDate rewardDate;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "claimed_at", nullable = false, updatable = false)
    private Instant claimedAt;
}
