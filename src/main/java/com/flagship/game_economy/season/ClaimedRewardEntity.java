package com.flagship.game_economy.season;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Proof that a tier's reward was paid out. The (progression, tier) unique constraint
 * is what makes claiming idempotent under concurrency.
 */
@Entity
@Table(name = "claimed_rewards")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ClaimedRewardEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "progression_id", nullable = false, updatable = false)
    private UUID progressionId;

    @Column(name = "tier_number", nullable = false, updatable = false)
    private int tierNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "reward_type", nullable = false, updatable = false, length = 30)
    private RewardType rewardType;

    @Column(name = "reward_amount", nullable = false, updatable = false)
    private int rewardAmount;

    @Column(name = "claimed_at", nullable = false, updatable = false)
    private Instant claimedAt;
}
