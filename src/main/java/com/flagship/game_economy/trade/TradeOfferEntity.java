package com.flagship.game_economy.trade;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Persistent form of {@link TradeOffer}. Items are written once with the offer and never change.
 */
@Entity
@Table(name = "trade_offers")
@Getter
@NoArgsConstructor
public class TradeOfferEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "from_competitor_id", nullable = false, updatable = false)
    private UUID fromCompetitorId;

    @Column(name = "to_competitor_id", nullable = false, updatable = false)
    private UUID toCompetitorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TradeStatus status;

    @Column(name = "offered_currency", nullable = false, updatable = false)
    private long offeredCurrency;

    @Column(name = "requested_currency", nullable = false, updatable = false)
    private long requestedCurrency;

    @Column(name = "message", length = 500, updatable = false)
    private String message;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @OneToMany(mappedBy = "trade", cascade = {CascadeType.PERSIST, CascadeType.MERGE})
    private List<TradeItemEntity> items = new ArrayList<>();

    public static TradeOfferEntity fromDomain(TradeOffer offer) {
        TradeOfferEntity entity = new TradeOfferEntity();
        entity.id = offer.getId();
        entity.fromCompetitorId = offer.getFromCompetitorId();
        entity.toCompetitorId = offer.getToCompetitorId();
        entity.status = offer.getStatus();
        entity.offeredCurrency = offer.getOfferedCurrency();
        entity.requestedCurrency = offer.getRequestedCurrency();
        entity.message = offer.getMessage();
        entity.expiresAt = offer.getExpiresAt();
        entity.createdAt = offer.getCreatedAt();
        entity.completedAt = offer.getCompletedAt();
        offer.getItems().forEach(item -> entity.items.add(new TradeItemEntity(entity, item)));
        return entity;
    }

    /**
     * Must be called inside a transaction: items load lazily.
     */
    public TradeOffer toDomain() {
        return new TradeOffer(
            id,
            fromCompetitorId,
            toCompetitorId,
            status,
            offeredCurrency,
            requestedCurrency,
            message,
            items.stream().map(TradeItemEntity::toDomain).toList(),
            expiresAt,
            createdAt,
            completedAt
        );
    }

    /**
     * Copies the mutable part of a transitioned offer onto this row.
     */
    public void applyTransition(TradeOffer transitioned) {
        this.status = transitioned.getStatus();
        this.completedAt = transitioned.getCompletedAt();
    }
}
