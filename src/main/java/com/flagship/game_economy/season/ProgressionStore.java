package com.flagship.game_economy.season;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Row-level access to season_progressions.
 */
@Repository
@RequiredArgsConstructor
public class ProgressionStore {

    private static final String COLUMNS =
            "id, competitor_id, season_id, current_tier, current_xp, has_battle_pass, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Returns the competitor's progression locked FOR UPDATE, creating it at tier 0 / 0 XP first
     * if needed. When two first calls race, the loser's insert is a no-op and it blocks on the
     * winner's row lock instead.
     */
    public SeasonProgression lockOrCreate(UUID competitorId, UUID seasonId) {
        jdbcTemplate.update(
            "INSERT INTO season_progressions (id, competitor_id, season_id, current_tier, current_xp, has_battle_pass) " +
            "VALUES (?, ?, ?, 0, 0, FALSE) ON CONFLICT (competitor_id, season_id) DO NOTHING",
            UUID.randomUUID(),
            competitorId,
            seasonId
        );
        return lock(competitorId, seasonId)
                .orElseThrow(() -> new IllegalStateException(
                        "Progression missing after insert for competitor " + competitorId + " season " + seasonId));
    }

    public Optional<SeasonProgression> lock(UUID competitorId, UUID seasonId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM season_progressions WHERE competitor_id = ? AND season_id = ? FOR UPDATE",
            rowMapper(),
            competitorId,
            seasonId
        ).stream().findFirst();
    }

    public Optional<SeasonProgression> find(UUID competitorId, UUID seasonId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM season_progressions WHERE competitor_id = ? AND season_id = ?",
            rowMapper(),
            competitorId,
            seasonId
        ).stream().findFirst();
    }

    public void updatePosition(UUID progressionId, int tier, int xp) {
        jdbcTemplate.update(
            "UPDATE season_progressions SET current_tier = ?, current_xp = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            tier,
            xp,
            progressionId
        );
    }

    public void grantBattlePass(UUID progressionId) {
        jdbcTemplate.update(
            "UPDATE season_progressions SET has_battle_pass = TRUE, updated_at = CURRENT_TIMESTAMP WHERE id = ?",
            progressionId
        );
    }

    private RowMapper<SeasonProgression> rowMapper() {
        return (rs, rowNum) -> new SeasonProgression(
            rs.getObject("id", UUID.class),
            rs.getObject("competitor_id", UUID.class),
            rs.getObject("season_id", UUID.class),
            rs.getInt("current_tier"),
            rs.getInt("current_xp"),
            rs.getBoolean("has_battle_pass"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }
}
