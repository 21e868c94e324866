package com.flagship.game_economy.trade;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TradeOfferRepository extends JpaRepository<TradeOfferEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM TradeOfferEntity t WHERE t.id = :id")
    Optional<TradeOfferEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT t FROM TradeOfferEntity t
        WHERE (t.fromCompetitorId = :competitorId OR t.toCompetitorId = :competitorId)
          AND t.status = com.flagship.game_economy.trade.TradeStatus.PENDING
          AND t.expiresAt >= :now
        ORDER BY t.createdAt DESC
        """)
    List<TradeOfferEntity> findOpenOffersInvolving(@Param("competitorId") UUID competitorId,
                                                   @Param("now") Instant now);

    /**
     * Claims a batch of PENDING offers past their expiry. Rows locked by a concurrent
     * respond are skipped and picked up by a later sweep.
     */
    @Query(value = """
        SELECT * FROM trade_offers
        WHERE status = 'PENDING' AND expires_at < :now
        ORDER BY expires_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<TradeOfferEntity> findExpiredPendingForUpdate(@Param("now") Instant now, @Param("limit") int limit);
}
