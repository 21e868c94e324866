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
import org.hibernate.annotations.Immutable;

import java.util.UUID;

@Entity
@Immutable
@Table(name = "season_tiers")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SeasonTierEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "season_id", nullable = false)
    private UUID seasonId;

    @Column(name = "tier_number", nullable = false)
    private int tierNumber;

    @Column(name = "xp_required", nullable = false)
    private int xpRequired;

    @Enumerated(EnumType.STRING)
    @Column(name = "reward_type", nullable = false, length = 30)
    private RewardType rewardType;

    @Column(name = "reward_amount", nullable = false)
    private int rewardAmount;

    @Column(name = "reward_item_id")
    private UUID rewardItemId;

    @Column(name = "is_premium", nullable = false)
    private boolean premium;

    public SeasonTier toDomain() {
        return new SeasonTier(tierNumber, xpRequired, rewardType, rewardAmount, rewardItemId, premium);
    }
}
