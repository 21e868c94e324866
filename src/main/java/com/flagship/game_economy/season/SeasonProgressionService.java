package com.flagship.game_economy.season;

import com.flagship.game_economy.common.exception.AlreadyClaimedException;
import com.flagship.game_economy.common.exception.AlreadyPurchasedException;
import com.flagship.game_economy.common.exception.BattlePassRequiredException;
import com.flagship.game_economy.common.exception.InsufficientFundsException;
import com.flagship.game_economy.common.exception.InvalidRequestException;
import com.flagship.game_economy.common.exception.RecipientNotFoundException;
import com.flagship.game_economy.common.exception.SeasonNotFoundException;
import com.flagship.game_economy.common.exception.TierNotFoundException;
import com.flagship.game_economy.common.exception.TierNotReachedException;
import com.flagship.game_economy.config.EconomyProperties;
import com.flagship.game_economy.inventory.InventoryService;
import com.flagship.game_economy.ledger.CurrencyBalance;
import com.flagship.game_economy.ledger.LedgerService;
import com.flagship.game_economy.ledger.TransactionType;
import com.flagship.game_economy.observability.CorrelationContext;
import com.flagship.game_economy.observability.EconomyMetrics;
import com.flagship.game_economy.outbox.OutboxService;
import com.flagship.game_economy.season.event.BattlePassPurchasedEvent;
import com.flagship.game_economy.season.event.SeasonRewardClaimedEvent;
import com.flagship.game_economy.season.event.SeasonTierUpEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Season XP, tier progression, reward claims and battle passes.
 *
 * Every mutating operation locks the competitor's progression row before touching
 * balances or inventory, which keeps the global lock order (aggregate, balances, inventory).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeasonProgressionService {

    private static final int REWARD_LOOKAHEAD_TIERS = 5;

    private final ProgressionStore progressionStore;
    private final SeasonRepository seasonRepository;
    private final SeasonTierRepository seasonTierRepository;
    private final ClaimedRewardRepository claimedRewardRepository;
    private final BattlePassRepository battlePassRepository;
    private final SeasonXpHistoryRepository xpHistoryRepository;
    private final LedgerService ledgerService;
    private final InventoryService inventoryService;
    private final OutboxService outboxService;
    private final EconomyProperties properties;
    private final EconomyMetrics metrics;

    /**
     * Adds XP, crossing as many tiers as it pays for. The progression is created at
     * tier 0 on the first award.
     */
    @Transactional
    public XpAwardResult awardXp(UUID competitorId, UUID seasonId, int amount, String source) {
        if (amount <= 0) {
            throw new InvalidRequestException("XP amount must be positive");
        }
        if (source == null || source.isBlank()) {
            throw new InvalidRequestException("XP source is required");
        }
        requireSeason(seasonId);

        MDC.put(CorrelationContext.COMPETITOR_ID_MDC_KEY, competitorId.toString());
        try {
            SeasonProgression progression = progressionStore.lockOrCreate(competitorId, seasonId);
            List<SeasonTier> tiers = loadTiers(seasonId);

            TierRollover.Result rollover =
                    TierRollover.apply(progression.getCurrentTier(), progression.getCurrentXp(), amount, tiers);

            progressionStore.updatePosition(progression.getId(), rollover.tier(), rollover.xp());
            xpHistoryRepository.save(new SeasonXpHistoryEntity(
                UUID.randomUUID(),
                competitorId,
                seasonId,
                amount,
                source,
                progression.getCurrentTier(),
                rollover.tier(),
                Instant.now()
            ));

            if (rollover.tieredUp()) {
                outboxService.saveEvent(new SeasonTierUpEvent(
                    UUID.randomUUID(),
                    progression.getId(),
                    competitorId,
                    seasonId,
                    progression.getCurrentTier(),
                    rollover.tier(),
                    rollover.tiersReached().stream().map(SeasonTier::tierNumber).toList(),
                    Instant.now()
                ));
            }

            metrics.recordXpAwarded(amount, rollover.tiersReached().size());
            log.info("Season XP awarded: season={}, amount={}, source={}, tier {} -> {}, xp={}",
                    seasonId, amount, source, progression.getCurrentTier(), rollover.tier(), rollover.xp());

            return new XpAwardResult(progression.withPosition(rollover.tier(), rollover.xp()),
                    rollover.tiersReached());
        } finally {
            MDC.remove(CorrelationContext.COMPETITOR_ID_MDC_KEY);
        }
    }

    /**
     * Pays out a reached tier's reward exactly once.
     *
     * @throws TierNotReachedException if there is no progression or it is below the tier
     * @throws TierNotFoundException if the season has no such tier
     * @throws BattlePassRequiredException for premium tiers without a battle pass
     * @throws AlreadyClaimedException if the tier was claimed before
     */
    @Transactional
    public ClaimedReward claimReward(UUID competitorId, UUID seasonId, int tierNumber) {
        SeasonProgression progression = progressionStore.lock(competitorId, seasonId)
                .orElseThrow(() -> new TierNotReachedException(tierNumber, 0));
        if (!progression.hasReached(tierNumber)) {
            throw new TierNotReachedException(tierNumber, progression.getCurrentTier());
        }

        SeasonTier tier = seasonTierRepository.findBySeasonIdAndTierNumber(seasonId, tierNumber)
                .map(SeasonTierEntity::toDomain)
                .orElseThrow(() -> new TierNotFoundException(seasonId, tierNumber));
        if (tier.premium() && !progression.isHasBattlePass()) {
            metrics.recordClaim(tier.rewardType().name(), "battle_pass_required");
            throw new BattlePassRequiredException(tierNumber);
        }
        if (claimedRewardRepository.existsByProgressionIdAndTierNumber(progression.getId(), tierNumber)) {
            metrics.recordClaim(tier.rewardType().name(), "already_claimed");
            throw new AlreadyClaimedException("Reward for tier " + tierNumber + " has already been claimed");
        }

        if (tier.rewardType().isCurrency() && tier.rewardAmount() > 0
                && !ledgerService.lockBalances(competitorId).containsKey(competitorId)) {
            throw new RecipientNotFoundException(competitorId);
        }

        Instant now = Instant.now();
        ClaimedRewardEntity claim = claimedRewardRepository.saveAndFlush(new ClaimedRewardEntity(
            UUID.randomUUID(),
            progression.getId(),
            tierNumber,
            tier.rewardType(),
            tier.rewardAmount(),
            now
        ));

        payOut(competitorId, seasonId, tier);

        ClaimedReward reward = new ClaimedReward(
            claim.getId(),
            competitorId,
            seasonId,
            tierNumber,
            tier.rewardType(),
            tier.rewardAmount(),
            tier.rewardItemId(),
            now
        );
        outboxService.saveEvent(SeasonRewardClaimedEvent.of(progression.getId(), reward));

        metrics.recordClaim(tier.rewardType().name(), "success");
        log.info("Season reward claimed: competitor={}, season={}, tier={}, type={}, amount={}",
                competitorId, seasonId, tierNumber, tier.rewardType(), tier.rewardAmount());
        return reward;
    }

    /**
     * Buys the season's battle pass. A null price means the season's list price, or the
     * configured default when the season has none.
     */
    @Transactional
    public BattlePass purchaseBattlePass(UUID competitorId, UUID seasonId, Long price) {
        SeasonEntity season = requireSeason(seasonId);

        boolean hasPass = progressionStore.lock(competitorId, seasonId)
                .map(SeasonProgression::isHasBattlePass)
                .orElse(false);
        if (hasPass || battlePassRepository.existsByCompetitorIdAndSeasonId(competitorId, seasonId)) {
            throw new AlreadyPurchasedException(competitorId, seasonId);
        }

        long pricePaid = resolvePrice(season, price);
        CurrencyBalance balance = ledgerService.lockBalances(competitorId).get(competitorId);
        long available = balance != null ? balance.getBalance() : 0L;
        if (available < pricePaid) {
            throw new InsufficientFundsException(competitorId, pricePaid, available);
        }

        SeasonProgression progression = progressionStore.lockOrCreate(competitorId, seasonId);
        ledgerService.burn(competitorId, pricePaid, "Battle pass for season " + season.getName(), TransactionType.PURCHASE);

        BattlePassEntity battlePass = battlePassRepository.save(new BattlePassEntity(
            UUID.randomUUID(),
            competitorId,
            seasonId,
            pricePaid,
            BattlePassEntity.STATUS_ACTIVE,
            Instant.now()
        ));
        progressionStore.grantBattlePass(progression.getId());

        outboxService.saveEvent(new BattlePassPurchasedEvent(
            UUID.randomUUID(),
            progression.getId(),
            competitorId,
            seasonId,
            pricePaid,
            Instant.now()
        ));

        metrics.recordBattlePassPurchase();
        log.info("Battle pass purchased: competitor={}, season={}, price={}", competitorId, seasonId, pricePaid);
        return BattlePass.fromEntity(battlePass);
    }

    /**
     * Current position plus reward status for every tier up to five past the current one.
     * Creates the progression at tier 0 if the competitor has none yet.
     */
    @Transactional
    public ProgressionView getProgression(UUID competitorId, UUID seasonId) {
        requireSeason(seasonId);
        SeasonProgression progression = progressionStore.find(competitorId, seasonId)
                .orElseGet(() -> progressionStore.lockOrCreate(competitorId, seasonId));

        List<SeasonTier> tiers = loadTiers(seasonId);
        Set<Integer> claimed = claimedRewardRepository.findByProgressionIdOrderByTierNumberAsc(progression.getId())
                .stream()
                .map(ClaimedRewardEntity::getTierNumber)
                .collect(Collectors.toSet());

        Integer nextTierXp = tiers.stream()
                .filter(tier -> tier.tierNumber() == progression.getCurrentTier() + 1)
                .map(SeasonTier::xpRequired)
                .findFirst()
                .orElse(null);

        List<ProgressionView.TierRewardStatus> rewards = tiers.stream()
                .filter(tier -> tier.tierNumber() <= progression.getCurrentTier() + REWARD_LOOKAHEAD_TIERS)
                .map(tier -> new ProgressionView.TierRewardStatus(
                    tier.tierNumber(),
                    tier.rewardType(),
                    tier.rewardAmount(),
                    tier.premium(),
                    claimed.contains(tier.tierNumber()),
                    progression.hasReached(tier.tierNumber()) && (!tier.premium() || progression.isHasBattlePass())
                ))
                .toList();

        return new ProgressionView(progression, nextTierXp, rewards);
    }

    private void payOut(UUID competitorId, UUID seasonId, SeasonTier tier) {
        String reason = "Season " + seasonId + " tier " + tier.tierNumber() + " reward";
        if (tier.rewardType().isCurrency()) {
            if (tier.rewardAmount() > 0) {
                ledgerService.mint(competitorId, tier.rewardAmount(), reason, TransactionType.REWARD);
            }
            return;
        }
        if (tier.rewardItemId() == null) {
            throw new IllegalStateException("Tier " + tier.tierNumber() + " of season " + seasonId
                    + " has an ITEM reward without an item id");
        }
        inventoryService.acquire(competitorId, tier.rewardItemId(), Math.max(1, tier.rewardAmount()));
    }

    private long resolvePrice(SeasonEntity season, Long requested) {
        long price;
        if (requested != null) {
            price = requested;
        } else if (season.getBattlePassPrice() != null) {
            price = season.getBattlePassPrice();
        } else {
            price = properties.season().defaultBattlePassPrice();
        }
        if (price <= 0) {
            throw new InvalidRequestException("Battle pass price must be positive");
        }
        return price;
    }

    private SeasonEntity requireSeason(UUID seasonId) {
        return seasonRepository.findById(seasonId)
                .orElseThrow(() -> new SeasonNotFoundException(seasonId));
    }

    private List<SeasonTier> loadTiers(UUID seasonId) {
        return seasonTierRepository.findBySeasonIdOrderByTierNumberAsc(seasonId)
                .stream()
                .map(SeasonTierEntity::toDomain)
                .toList();
    }
}
