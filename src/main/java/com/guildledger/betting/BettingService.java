package com.guildledger.betting;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetService;
import com.guildledger.ledger.AccountLockManager;
import com.guildledger.ledger.JournalRequest;
import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.ledger.TransactionFactory;
import com.guildledger.ledger.TransactionKind;
import com.guildledger.ledger.TreasuryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Betting pools kept on the ledger.
 *
 * Stakes move from the bettor to the tenant's escrow account when placed. On
 * settlement escrow releases the whole pool: backers of the winner receive
 * {@code floor(stake * odds)} and the treasury takes the remainder, or funds
 * the shortfall when payouts exceed the pool. Cancelling refunds every stake.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BettingService {

    private final BettingEventRepository eventRepository;
    private final BettingPlayerRepository playerRepository;
    private final BetRepository betRepository;
    private final AssetService assetService;
    private final AccountDirectory accountDirectory;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final TreasuryService treasuryService;
    private final Clock clock;

    /**
     * Open a new event.
     *
     * @throws IllegalStateException if the tenant already has an active event
     */
    public BettingEvent openEvent(String tenantId, String createdBy, String name, String symbol) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Event name cannot be blank");
        }
        Asset asset = assetService.getAsset(tenantId, symbol);
        BettingEvent event = ledgerExecutor.execute("open betting event", List.of("betting-tenant:" + tenantId), () -> {
            if (eventRepository.findFirstByTenantIdAndStatus(tenantId, BettingStatus.ACTIVE).isPresent()) {
                throw new IllegalStateException("Tenant " + tenantId + " already has an active betting event");
            }
            return eventRepository.save(new BettingEvent(tenantId, name.strip(), asset.getId(), createdBy,
                clock.instant()));
        });
        log.info("Opened betting event {} ({}) in tenant {}", event.getName(), event.getId(), tenantId);
        return event;
    }

    public BettingPlayer addPlayer(String eventId, String userId) {
        return ledgerExecutor.execute("add betting player", List.of(eventKey(eventId)), () -> {
            getEvent(eventId).requireActive();
            if (playerRepository.existsByEventIdAndUserId(eventId, userId)) {
                throw new IllegalStateException(String.format("%s is already a player of %s", userId, eventId));
            }
            return playerRepository.save(new BettingPlayer(eventId, userId, clock.instant()));
        });
    }

    /**
     * Remove a player nobody has bet on.
     *
     * @throws IllegalStateException if bets were placed on the player
     */
    public void removePlayer(String eventId, String userId) {
        ledgerExecutor.execute("remove betting player", List.of(eventKey(eventId)), () -> {
            getEvent(eventId).requireActive();
            BettingPlayer player = playerRepository.findByEventIdAndUserId(eventId, userId)
                .orElseThrow(() -> new IllegalArgumentException(
                    String.format("%s is not a player of %s", userId, eventId)));
            if (betRepository.existsByEventIdAndTargetUserId(eventId, userId)) {
                throw new IllegalStateException(String.format(
                    "Cannot remove %s from %s: bets were placed on them", userId, eventId));
            }
            playerRepository.delete(player);
            return null;
        });
    }

    @Transactional(readOnly = true)
    public List<BettingPlayer> players(String eventId) {
        return playerRepository.findByEventIdOrderByAddedAtAsc(eventId);
    }

    /**
     * Stake whole units on a player.
     *
     * @throws com.guildledger.common.exception.InsufficientBalanceException if the bettor cannot cover the stake
     */
    public Bet placeBet(String eventId, String userId, String targetUserId, long stake) {
        if (stake <= 0) {
            throw new IllegalArgumentException("Stake must be a positive whole amount");
        }
        BettingEvent snapshot = getEvent(eventId);
        BigDecimal amount = BigDecimal.valueOf(stake);
        String bettorId = accountDirectory.ensureUserAccount(snapshot.getTenantId(), userId);
        String escrowId = accountDirectory.systemAccountId(snapshot.getTenantId(), AccountType.ESCROW);

        List<String> lockKeys = List.of(
            eventKey(eventId),
            AccountLockManager.balanceKey(bettorId, snapshot.getAssetId()),
            AccountLockManager.balanceKey(escrowId, snapshot.getAssetId()));
        Bet bet = ledgerExecutor.execute("place bet", lockKeys, () -> {
            BettingEvent event = getEvent(eventId);
            event.requireActive();
            if (!playerRepository.existsByEventIdAndUserId(eventId, targetUserId)) {
                throw new IllegalArgumentException(String.format("%s is not a player of %s", targetUserId, eventId));
            }
            String transactionId = transactionFactory.record(JournalRequest.builder()
                .kind(TransactionKind.BET_STAKE)
                .createdBy(userId)
                .reference("Bet on " + targetUserId + " in " + event.getName())
                .move(bettorId, escrowId, event.getAssetId(), amount)
                .build());
            event.setPool(event.getPool().add(amount));
            eventRepository.save(event);
            return betRepository.save(new Bet(eventId, userId, targetUserId, amount, transactionId, clock.instant()));
        });

        log.info("Bet of {} by {} on {} in event {}", stake, userId, targetUserId, eventId);
        return bet;
    }

    /**
     * Current odds for a player.
     */
    @Transactional(readOnly = true)
    public BigDecimal odds(String eventId, String targetUserId) {
        BettingEvent event = getEvent(eventId);
        return OddsCalculator.odds(event.getPool(), stakedOn(betRepository.findByEventIdOrderByPlacedAtAsc(eventId),
            targetUserId));
    }

    /**
     * Close the event with a winner and pay out the pool.
     */
    public BettingSettlement settle(String eventId, String winnerUserId) {
        BettingEvent snapshot = getEvent(eventId);
        String tenantId = snapshot.getTenantId();
        String assetId = snapshot.getAssetId();
        String escrowId = accountDirectory.systemAccountId(tenantId, AccountType.ESCROW);
        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
        String mintId = accountDirectory.systemAccountId(tenantId, AccountType.MINT);

        List<String> lockKeys = new ArrayList<>(TreasuryService.lockKeys(treasuryId, mintId, assetId));
        lockKeys.add(eventKey(eventId));
        lockKeys.add(AccountLockManager.balanceKey(escrowId, assetId));

        Runnable fundShortfall = () -> {
            BettingEvent event = getEvent(eventId);
            BigDecimal shortfall = totalPayout(payouts(event, winnerUserId)).subtract(event.getPool());
            if (shortfall.signum() > 0) {
                treasuryService.autoRefillTreasuryIfNeeded(treasuryId, assetId, tenantId, shortfall);
            }
        };

        BettingSettlement settlement = ledgerExecutor.execute("settle betting event", lockKeys, fundShortfall, () -> {
            BettingEvent event = getEvent(eventId);
            event.requireActive();
            if (!playerRepository.existsByEventIdAndUserId(eventId, winnerUserId)) {
                throw new IllegalArgumentException(String.format("%s is not a player of %s", winnerUserId, eventId));
            }
            List<Bet> bets = betRepository.findByEventIdOrderByPlacedAtAsc(eventId);
            BigDecimal pool = event.getPool();
            BigDecimal odds = OddsCalculator.odds(pool, stakedOn(bets, winnerUserId));
            Map<String, BigDecimal> payouts = payouts(event, winnerUserId);
            BigDecimal treasuryDelta = pool.subtract(totalPayout(payouts));

            String transactionId = null;
            if (pool.signum() > 0) {
                JournalRequest.JournalRequestBuilder request = JournalRequest.builder()
                    .kind(TransactionKind.BET_SETTLEMENT)
                    .idempotencyKey("betting:settle:" + eventId)
                    .reference("Settlement of " + event.getName())
                    .leg(new JournalRequest.Leg(escrowId, assetId, pool.negate()));
                payouts.forEach((bettor, payout) -> request.leg(new JournalRequest.Leg(
                    accountDirectory.ensureUserAccount(tenantId, bettor), assetId, payout)));
                if (treasuryDelta.signum() != 0) {
                    request.leg(new JournalRequest.Leg(treasuryId, assetId, treasuryDelta));
                }
                transactionId = transactionFactory.record(request.build());
            }

            event.close(BettingStatus.SETTLED, winnerUserId, clock.instant());
            eventRepository.save(event);
            return new BettingSettlement(eventId, winnerUserId, pool, odds, payouts, treasuryDelta, transactionId);
        });

        log.info("Settled betting event {}: winner {}, pool {}, odds {}, treasury delta {}", eventId, winnerUserId,
            settlement.getPool().toPlainString(), settlement.getOdds().toPlainString(),
            settlement.getTreasuryDelta().toPlainString());
        return settlement;
    }

    /**
     * Close the event without a winner and refund every stake.
     *
     * @return refunds per bettor
     */
    public Map<String, BigDecimal> cancel(String eventId) {
        BettingEvent snapshot = getEvent(eventId);
        String tenantId = snapshot.getTenantId();
        String assetId = snapshot.getAssetId();
        String escrowId = accountDirectory.systemAccountId(tenantId, AccountType.ESCROW);

        List<String> lockKeys = List.of(eventKey(eventId), AccountLockManager.balanceKey(escrowId, assetId));
        Map<String, BigDecimal> refunds = ledgerExecutor.execute("cancel betting event", lockKeys, () -> {
            BettingEvent event = getEvent(eventId);
            event.requireActive();
            Map<String, BigDecimal> stakes = new LinkedHashMap<>();
            for (Bet bet : betRepository.findByEventIdOrderByPlacedAtAsc(eventId)) {
                stakes.merge(bet.getUserId(), bet.getAmount(), BigDecimal::add);
            }
            if (event.getPool().signum() > 0) {
                JournalRequest.JournalRequestBuilder request = JournalRequest.builder()
                    .kind(TransactionKind.BET_REFUND)
                    .idempotencyKey("betting:cancel:" + eventId)
                    .reference("Refund of " + event.getName())
                    .leg(new JournalRequest.Leg(escrowId, assetId, event.getPool().negate()));
                stakes.forEach((bettor, stake) -> request.leg(new JournalRequest.Leg(
                    accountDirectory.ensureUserAccount(tenantId, bettor), assetId, stake)));
                transactionFactory.record(request.build());
            }
            event.close(BettingStatus.CANCELLED, null, clock.instant());
            eventRepository.save(event);
            return stakes;
        });

        log.info("Cancelled betting event {}, refunded {} bettors", eventId, refunds.size());
        return refunds;
    }

    @Transactional(readOnly = true)
    public Optional<BettingEvent> activeEvent(String tenantId) {
        return eventRepository.findFirstByTenantIdAndStatus(tenantId, BettingStatus.ACTIVE);
    }

    @Transactional(readOnly = true)
    public List<Bet> bets(String eventId) {
        return betRepository.findByEventIdOrderByPlacedAtAsc(eventId);
    }

    @Transactional(readOnly = true)
    public BettingEvent getEvent(String eventId) {
        return eventRepository.findById(eventId)
            .orElseThrow(() -> new IllegalArgumentException("Betting event not found: " + eventId));
    }

    private Map<String, BigDecimal> payouts(BettingEvent event, String winnerUserId) {
        List<Bet> bets = betRepository.findByEventIdOrderByPlacedAtAsc(event.getId());
        BigDecimal odds = OddsCalculator.odds(event.getPool(), stakedOn(bets, winnerUserId));
        Map<String, BigDecimal> payouts = new LinkedHashMap<>();
        for (Bet bet : bets) {
            if (bet.getTargetUserId().equals(winnerUserId)) {
                BigDecimal payout = OddsCalculator.payout(bet.getAmount(), odds);
                if (payout.signum() > 0) {
                    payouts.merge(bet.getUserId(), payout, BigDecimal::add);
                }
            }
        }
        return payouts;
    }

    private static BigDecimal stakedOn(List<Bet> bets, String targetUserId) {
        return bets.stream()
            .filter(bet -> bet.getTargetUserId().equals(targetUserId))
            .map(Bet::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal totalPayout(Map<String, BigDecimal> payouts) {
        return payouts.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static String eventKey(String eventId) {
        return "betting-event:" + eventId;
    }
}
