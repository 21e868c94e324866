package com.flagship.game_economy.ledger;

import com.flagship.game_economy.common.LockOrdering;
import com.flagship.game_economy.common.exception.BalanceNotFoundException;
import com.flagship.game_economy.common.exception.InsufficientFundsException;
import com.flagship.game_economy.common.exception.InvalidRequestException;
import com.flagship.game_economy.common.exception.RecipientNotFoundException;
import com.flagship.game_economy.ledger.event.CurrencyTransferredEvent;
import com.flagship.game_economy.observability.EconomyMetrics;
import com.flagship.game_economy.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The currency ledger and its Atomic Transfer primitive.
 *
 * Invariants enforced here:
 * 1. A balance never goes below zero (checked under lock, backed by a CHECK constraint)
 * 2. Every movement writes exactly one immutable currency_transactions row
 * 3. Balance rows are locked in {@link LockOrdering#ASCENDING} order, so two transfers
 *    between the same pair of competitors in opposite directions cannot deadlock.
 *    Across tables the order is: aggregate row (offer, shop item, progression), then
 *    balances, then inventory rows
 * 4. All validation happens before the first UPDATE; a failure leaves no partial effect
 *
 * Plain JDBC keeps the locking statements explicit. Callers own the transaction:
 * every mutating method joins the caller's transaction or opens one.
 */
@Service
@Slf4j
public class LedgerService {

    private final JdbcTemplate jdbcTemplate;
    private final TransferIdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final EconomyMetrics metrics;

    public LedgerService(JdbcTemplate jdbcTemplate,
                         TransferIdempotencyService idempotencyService,
                         OutboxService outboxService,
                         EconomyMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.idempotencyService = idempotencyService;
        this.outboxService = outboxService;
        this.metrics = metrics;
    }

    /**
     * Creates the balance row for a competitor if it does not exist yet.
     * A positive opening amount is minted so that the log accounts for it.
     *
     * @return the competitor's balance after opening
     */
    @Transactional
    public CurrencyBalance openBalance(UUID competitorId, UUID gameId, long openingAmount) {
        if (openingAmount < 0) {
            throw new InvalidRequestException("Opening amount cannot be negative");
        }
        int inserted = jdbcTemplate.update(
            "INSERT INTO currency_balances (id, competitor_id, game_id, balance, created_at, updated_at) " +
            "VALUES (?, ?, ?, 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (competitor_id) DO NOTHING",
            UUID.randomUUID(),
            competitorId,
            gameId
        );
        if (inserted == 1 && openingAmount > 0) {
            mint(competitorId, openingAmount, "Opening balance", TransactionType.REWARD);
        }
        return getBalance(competitorId);
    }

    /**
     * Peer-to-peer transfer.
     */
    @Transactional
    public CurrencyTransaction transfer(UUID fromCompetitorId, UUID toCompetitorId, long amount, String reason) {
        return transfer(fromCompetitorId, toCompetitorId, amount, reason, (String) null);
    }

    /**
     * Peer-to-peer transfer guarded by a client idempotency key.
     * If the key was already used, the original transaction is returned and no money moves.
     */
    @Transactional
    public CurrencyTransaction transfer(UUID fromCompetitorId, UUID toCompetitorId, long amount,
                                        String reason, String idempotencyKey) {
        if (fromCompetitorId == null) {
            throw new InvalidRequestException("Sender is required for a transfer");
        }
        if (idempotencyKey == null) {
            return postTransfer(fromCompetitorId, toCompetitorId, amount, reason, null);
        }

        Optional<CurrencyTransaction> existing = idempotencyService.findTransactionId(idempotencyKey)
                .flatMap(this::findTransaction);
        if (existing.isPresent()) {
            log.info("Idempotency key {} already used by transaction {}", idempotencyKey, existing.get().getId());
            metrics.recordIdempotencyHit();
            return existing.get();
        }
        metrics.recordIdempotencyMiss();

        CurrencyTransaction transaction = postTransfer(fromCompetitorId, toCompetitorId, amount, reason, idempotencyKey);
        idempotencyService.remember(idempotencyKey, transaction.getId());
        return transaction;
    }

    private CurrencyTransaction postTransfer(UUID fromCompetitorId, UUID toCompetitorId, long amount,
                                             String reason, String idempotencyKey) {
        if (toCompetitorId == null) {
            throw new InvalidRequestException("Recipient is required for a transfer");
        }
        CurrencyTransaction transaction =
                post(fromCompetitorId, toCompetitorId, amount, reason, TransactionType.TRANSFER, idempotencyKey);
        outboxService.saveEvent(CurrencyTransferredEvent.fromTransaction(transaction));
        return transaction;
    }

    /**
     * Moves currency between two competitors with an explicit type (trade legs).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CurrencyTransaction transferTyped(UUID fromCompetitorId, UUID toCompetitorId, long amount,
                                             String reason, TransactionType type) {
        if (fromCompetitorId == null || toCompetitorId == null) {
            throw new InvalidRequestException("Both competitors are required for a " + type + " transfer");
        }
        return post(fromCompetitorId, toCompetitorId, amount, reason, type, null);
    }

    /**
     * System mint: credits a competitor without a debit side.
     */
    @Transactional
    public CurrencyTransaction mint(UUID toCompetitorId, long amount, String reason, TransactionType type) {
        return post(null, toCompetitorId, amount, reason, type, null);
    }

    /**
     * Burn: debits a competitor without a credit side (shop purchases, battle passes).
     */
    @Transactional
    public CurrencyTransaction burn(UUID fromCompetitorId, long amount, String reason, TransactionType type) {
        if (fromCompetitorId == null) {
            throw new InvalidRequestException("Competitor is required for a debit");
        }
        return post(fromCompetitorId, null, amount, reason, type, null);
    }

    private CurrencyTransaction post(UUID fromCompetitorId, UUID toCompetitorId, long amount,
                                     String reason, TransactionType type, String idempotencyKey) {
        if (amount <= 0) {
            throw new InvalidRequestException("Amount must be positive");
        }
        if (fromCompetitorId != null && fromCompetitorId.equals(toCompetitorId)) {
            throw new InvalidRequestException("Sender and recipient must be different");
        }

        // Lock both rows in a fixed order before reading anything we validate against
        Map<UUID, CurrencyBalance> locked = lockBalances(fromCompetitorId, toCompetitorId);

        if (fromCompetitorId != null) {
            CurrencyBalance sender = locked.get(fromCompetitorId);
            long available = sender != null ? sender.getBalance() : 0L;
            if (sender == null || !sender.covers(amount)) {
                metrics.recordTransfer(type, "insufficient_funds");
                throw new InsufficientFundsException(fromCompetitorId, amount, available);
            }
        }
        if (toCompetitorId != null && !locked.containsKey(toCompetitorId)) {
            metrics.recordTransfer(type, "recipient_not_found");
            throw new RecipientNotFoundException(toCompetitorId);
        }

        if (fromCompetitorId != null) {
            adjustBalance(fromCompetitorId, -amount);
        }
        if (toCompetitorId != null) {
            adjustBalance(toCompetitorId, amount);
        }

        CurrencyTransaction transaction = new CurrencyTransaction(
            UUID.randomUUID(),
            fromCompetitorId,
            toCompetitorId,
            amount,
            reason,
            TransactionStatus.COMPLETED,
            type,
            idempotencyKey,
            Instant.now()
        );
        jdbcTemplate.update(
            "INSERT INTO currency_transactions " +
            "(id, from_competitor_id, to_competitor_id, amount, reason, status, type, idempotency_key, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            transaction.getId(),
            fromCompetitorId,
            toCompetitorId,
            amount,
            reason,
            transaction.getStatus().name(),
            type.name(),
            idempotencyKey,
            Timestamp.from(transaction.getCreatedAt())
        );

        metrics.recordTransfer(type, "success");
        log.info("Currency {} completed: txId={}, from={}, to={}, amount={}",
                type, transaction.getId(), fromCompetitorId, toCompetitorId, amount);
        return transaction;
    }

    /**
     * Locks the balance rows of the given competitors in lock order and returns those that exist.
     * Operations that also lock inventory rows call this first so balances are always locked
     * before inventory.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<UUID, CurrencyBalance> lockBalances(UUID... competitorIds) {
        Map<UUID, CurrencyBalance> locked = new HashMap<>();
        for (UUID competitorId : LockOrdering.inLockOrder(Arrays.asList(competitorIds))) {
            List<CurrencyBalance> rows = jdbcTemplate.query(
                "SELECT id, competitor_id, game_id, balance, updated_at FROM currency_balances " +
                "WHERE competitor_id = ? FOR UPDATE",
                balanceRowMapper(),
                competitorId
            );
            if (!rows.isEmpty()) {
                locked.put(competitorId, rows.get(0));
            }
        }
        return locked;
    }

    private void adjustBalance(UUID competitorId, long delta) {
        jdbcTemplate.update(
            "UPDATE currency_balances SET balance = balance + ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE competitor_id = ?",
            delta,
            competitorId
        );
    }

    @Transactional(readOnly = true)
    public CurrencyBalance getBalance(UUID competitorId) {
        return findBalance(competitorId)
            .orElseThrow(() -> new BalanceNotFoundException(competitorId));
    }

    @Transactional(readOnly = true)
    public Optional<CurrencyBalance> findBalance(UUID competitorId) {
        List<CurrencyBalance> rows = jdbcTemplate.query(
            "SELECT id, competitor_id, game_id, balance, updated_at FROM currency_balances WHERE competitor_id = ?",
            balanceRowMapper(),
            competitorId
        );
        return rows.stream().findFirst();
    }

    /**
     * Most recent transactions a competitor took part in, newest first.
     */
    @Transactional(readOnly = true)
    public List<CurrencyTransaction> getHistory(UUID competitorId, int limit) {
        return new ArrayList<>(jdbcTemplate.query(
            "SELECT id, from_competitor_id, to_competitor_id, amount, reason, status, type, idempotency_key, created_at " +
            "FROM currency_transactions WHERE from_competitor_id = ? OR to_competitor_id = ? " +
            "ORDER BY sequence_number DESC LIMIT ?",
            transactionRowMapper(),
            competitorId,
            competitorId,
            limit
        ));
    }

    @Transactional(readOnly = true)
    public Optional<CurrencyTransaction> findByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(
            "SELECT id, from_competitor_id, to_competitor_id, amount, reason, status, type, idempotency_key, created_at " +
            "FROM currency_transactions WHERE idempotency_key = ?",
            transactionRowMapper(),
            idempotencyKey
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<CurrencyTransaction> findTransaction(UUID transactionId) {
        return jdbcTemplate.query(
            "SELECT id, from_competitor_id, to_competitor_id, amount, reason, status, type, idempotency_key, created_at " +
            "FROM currency_transactions WHERE id = ?",
            transactionRowMapper(),
            transactionId
        ).stream().findFirst();
    }

    private RowMapper<CurrencyBalance> balanceRowMapper() {
        return (rs, rowNum) -> new CurrencyBalance(
            rs.getObject("id", UUID.class),
            rs.getObject("competitor_id", UUID.class),
            rs.getObject("game_id", UUID.class),
            rs.getLong("balance"),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    private RowMapper<CurrencyTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new CurrencyTransaction(
            rs.getObject("id", UUID.class),
            rs.getObject("from_competitor_id", UUID.class),
            rs.getObject("to_competitor_id", UUID.class),
            rs.getLong("amount"),
            rs.getString("reason"),
            TransactionStatus.valueOf(rs.getString("status")),
            TransactionType.valueOf(rs.getString("type")),
            rs.getString("idempotency_key"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
