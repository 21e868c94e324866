package com.flagship.game_economy.season;

import java.time.Instant;
import java.util.UUID;

public record BattlePass(UUID id,
                         UUID competitorId,
                         UUID seasonId,
                         long pricePaid,
                         String status,
                         Instant purchasedAt) {

    static BattlePass fromEntity(BattlePassEntity entity) {
        return new BattlePass(
            entity.getId(),
            entity.getCompetitorId(),
            entity.getSeasonId(),
            entity.getPricePaid(),
            entity.getStatus(),
            entity.getPurchasedAt()
        );
    }
}
