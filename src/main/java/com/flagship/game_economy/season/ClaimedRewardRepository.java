package com.flagship.game_economy.season;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ClaimedRewardRepository extends JpaRepository<ClaimedRewardEntity, UUID> {

    boolean existsByProgressionIdAndTierNumber(UUID progressionId, int tierNumber);

    List<ClaimedRewardEntity> findByProgressionIdOrderByTierNumberAsc(UUID progressionId);
}
