package com.flagship.game_economy.shop;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ShopTransactionRepository extends JpaRepository<ShopTransactionEntity, UUID> {

    List<ShopTransactionEntity> findByCompetitorIdOrderByCreatedAtDesc(UUID competitorId);
}
