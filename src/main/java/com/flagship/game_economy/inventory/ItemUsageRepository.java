package com.flagship.game_economy.inventory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ItemUsageRepository extends JpaRepository<ItemUsageEntity, UUID> {

    List<ItemUsageEntity> findByCompetitorIdAndItemIdOrderByUsedAtDesc(UUID competitorId, UUID itemId);
}
