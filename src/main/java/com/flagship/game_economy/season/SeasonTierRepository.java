package com.flagship.game_economy.season;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SeasonTierRepository extends JpaRepository<SeasonTierEntity, UUID> {

    List<SeasonTierEntity> findBySeasonIdOrderByTierNumberAsc(UUID seasonId);

    Optional<SeasonTierEntity> findBySeasonIdAndTierNumber(UUID seasonId, int tierNumber);
}
