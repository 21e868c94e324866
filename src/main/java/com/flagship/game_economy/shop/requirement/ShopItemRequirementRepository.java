package com.flagship.game_economy.shop.requirement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ShopItemRequirementRepository extends JpaRepository<ShopItemRequirementEntity, UUID> {

    List<ShopItemRequirementEntity> findByItemId(UUID itemId);
}
