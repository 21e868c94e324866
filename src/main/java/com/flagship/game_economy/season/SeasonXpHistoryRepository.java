package com.flagship.game_economy.season;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SeasonXpHistoryRepository extends JpaRepository<SeasonXpHistoryEntity, UUID> {

    List<SeasonXpHistoryEntity> findByCompetitorIdAndSeasonIdOrderByCreatedAtAsc(UUID competitorId, UUID seasonId);
}
