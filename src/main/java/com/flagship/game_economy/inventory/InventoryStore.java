package com.flagship.game_economy.inventory;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Row-level access to inventory_entries. Callers must already be in a transaction
 * for the locking reads to mean anything.
 */
@Repository
@RequiredArgsConstructor
public class InventoryStore {

    private static final String COLUMNS =
            "id, competitor_id, item_id, quantity, use_count, last_acquired_at, last_used_at";

    private final JdbcTemplate jdbcTemplate;

    public Optional<InventoryEntry> find(UUID competitorId, UUID itemId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM inventory_entries WHERE competitor_id = ? AND item_id = ?",
            rowMapper(),
            competitorId,
            itemId
        ).stream().findFirst();
    }

    public Optional<InventoryEntry> lock(UUID competitorId, UUID itemId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM inventory_entries WHERE competitor_id = ? AND item_id = ? FOR UPDATE",
            rowMapper(),
            competitorId,
            itemId
        ).stream().findFirst();
    }

    /**
     * Locks every existing row among {@code keys} in {@link InventoryKey#LOCK_ORDER}.
     * Keys without a row are absent from the result.
     */
    public Map<InventoryKey, InventoryEntry> lockAll(Collection<InventoryKey> keys) {
        Map<InventoryKey, InventoryEntry> locked = new LinkedHashMap<>();
        keys.stream()
                .distinct()
                .sorted(InventoryKey.LOCK_ORDER)
                .forEach(key -> lock(key.competitorId(), key.itemId())
                        .ifPresent(entry -> locked.put(key, entry)));
        return locked;
    }

    public List<InventoryEntry> findByCompetitor(UUID competitorId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM inventory_entries WHERE competitor_id = ? ORDER BY last_acquired_at DESC NULLS LAST",
            rowMapper(),
            competitorId
        );
    }

    /**
     * Adds {@code quantity} to the row, creating it if needed.
     * Concurrent inserts of the same row resolve to one row via the unique constraint.
     */
    public void increment(UUID competitorId, UUID itemId, int quantity, Instant at) {
        jdbcTemplate.update(
            "INSERT INTO inventory_entries (id, competitor_id, item_id, quantity, use_count, last_acquired_at) " +
            "VALUES (?, ?, ?, ?, 0, ?) " +
            "ON CONFLICT (competitor_id, item_id) DO UPDATE " +
            "SET quantity = inventory_entries.quantity + EXCLUDED.quantity, last_acquired_at = EXCLUDED.last_acquired_at",
            UUID.randomUUID(),
            competitorId,
            itemId,
            quantity,
            Timestamp.from(at)
        );
    }

    /**
     * @return false if the row is missing or holds less than {@code quantity}
     */
    public boolean decrement(UUID competitorId, UUID itemId, int quantity) {
        return jdbcTemplate.update(
            "UPDATE inventory_entries SET quantity = quantity - ? " +
            "WHERE competitor_id = ? AND item_id = ? AND quantity >= ?",
            quantity,
            competitorId,
            itemId,
            quantity
        ) == 1;
    }

    public void recordUse(UUID competitorId, UUID itemId, int quantity, Instant at) {
        jdbcTemplate.update(
            "UPDATE inventory_entries SET quantity = quantity - ?, use_count = use_count + 1, last_used_at = ? " +
            "WHERE competitor_id = ? AND item_id = ?",
            quantity,
            Timestamp.from(at),
            competitorId,
            itemId
        );
    }

    private RowMapper<InventoryEntry> rowMapper() {
        return (rs, rowNum) -> new InventoryEntry(
            rs.getObject("id", UUID.class),
            rs.getObject("competitor_id", UUID.class),
            rs.getObject("item_id", UUID.class),
            rs.getInt("quantity"),
            rs.getInt("use_count"),
            toInstant(rs.getTimestamp("last_acquired_at")),
            toInstant(rs.getTimestamp("last_used_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
