package com.flagship.game_economy.trade;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Entity
@Table(name = "trade_items")
@Getter
@NoArgsConstructor
public class TradeItemEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "trade_id", nullable = false, updatable = false)
    private TradeOfferEntity trade;

    @Column(name = "item_id", nullable = false, updatable = false)
    private UUID itemId;

    @Column(name = "quantity", nullable = false, updatable = false)
    private int quantity;

    @Column(name = "from_competitor", nullable = false, updatable = false)
    private boolean fromCompetitor;

    TradeItemEntity(TradeOfferEntity trade, TradeItem item) {
        this.id = UUID.randomUUID();
        this.trade = trade;
        this.itemId = item.getItemId();
        this.quantity = item.getQuantity();
        this.fromCompetitor = item.isFromCompetitor();
    }

    TradeItem toDomain() {
        return new TradeItem(itemId, quantity, fromCompetitor);
    }
}
