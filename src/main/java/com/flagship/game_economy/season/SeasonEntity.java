package com.flagship.game_economy.season;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.util.UUID;

/**
 * Season catalog row. Seeded outside this service.
 */
@Entity
@Immutable
@Table(name = "seasons")
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SeasonEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "game_id", nullable = false)
    private UUID gameId;

    @Column(name = "name", nullable = false)
    private String name;

    // null falls back to economy.season.default-battle-pass-price
    @Column(name = "battle_pass_price")
    private Long battlePassPrice;

    @Column(name = "active", nullable = false)
    private boolean active;
}
