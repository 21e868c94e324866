package com.flagship.game_economy.reward;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.UUID;

@Repository
public interface DailyRewardClaimRepository extends JpaRepository<DailyRewardClaimEntity, UUID> {

    boolean existsByCompetitorIdAndRewardDate(UUID competitorId, LocalDate rewardDate);
}
