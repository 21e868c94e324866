package com.flagship.game_economy.season;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BattlePassRepository extends JpaRepository<BattlePassEntity, UUID> {

    boolean existsByCompetitorIdAndSeasonId(UUID competitorId, UUID seasonId);

    Optional<BattlePassEntity> findByCompetitorIdAndSeasonId(UUID competitorId, UUID seasonId);
}
