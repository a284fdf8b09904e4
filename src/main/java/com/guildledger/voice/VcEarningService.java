package com.guildledger.voice;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetService;
import com.guildledger.common.IdempotencyKey;
import com.guildledger.config.GuildLedgerProperties;
import com.guildledger.config.GuildLedgerProperties.FundingSource;
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
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-minute earnings for time spent in voice channels.
 *
 * Sessions are durable rows. Every tick pays each session the rates of its
 * channel category, one unit per session, debiting the configured funding
 * account (mint or treasury). The tick's minute is part of the idempotency key,
 * so replaying a tick never pays the same minute twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VcEarningService {

    private final VcSessionRepository sessionRepository;
    private final VcEarningRateRepository rateRepository;
    private final VcEarningDailyRepository dailyRepository;
    private final AssetService assetService;
    private final AccountDirectory accountDirectory;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final TreasuryService treasuryService;
    private final GuildLedgerProperties properties;

    /**
     * Create or update the per-minute rate of a category in one currency.
     */
    @Transactional
    public VcEarningRate configureRate(String tenantId, String categoryId, String symbol, BigDecimal ratePerMinute) {
        if (categoryId == null || categoryId.isBlank()) {
            throw new IllegalArgumentException("Category id cannot be blank");
        }
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal rate = asset.truncatePositive(ratePerMinute);
        VcEarningRate earningRate = rateRepository.findByTenantIdAndCategoryIdAndAssetId(tenantId, categoryId, asset.getId())
            .map(existing -> {
                existing.setRatePerMinute(rate);
                return existing;
            })
            .orElseGet(() -> new VcEarningRate(tenantId, categoryId, asset.getId(), rate));
        log.info("VC earning rate for category {} in tenant {}: {} {}/min", categoryId, tenantId,
            rate.toPlainString(), asset.getSymbol());
        return rateRepository.save(earningRate);
    }

    @Transactional
    public boolean removeRate(String tenantId, String categoryId, String symbol) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        return rateRepository.findByTenantIdAndCategoryIdAndAssetId(tenantId, categoryId, asset.getId())
            .map(rate -> {
                rateRepository.delete(rate);
                return true;
            })
            .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<VcEarningRate> rates(String tenantId) {
        return rateRepository.findByTenantIdOrderByCategoryIdAsc(tenantId);
    }

    /**
     * Record that a member joined a voice channel, replacing any previous session.
     */
    @Transactional
    public VcSession startSession(String tenantId, String userId, String channelId, String categoryId, Instant now) {
        VcSession session = sessionRepository.findByTenantIdAndUserId(tenantId, userId)
            .map(existing -> {
                existing.setChannelId(channelId);
                existing.setCategoryId(categoryId);
                existing.setStartedAt(now);
                existing.setLastPaidAt(null);
                return existing;
            })
            .orElseGet(() -> new VcSession(tenantId, userId, channelId, categoryId, now));
        log.debug("VC session started for {} in channel {} of tenant {}", userId, channelId, tenantId);
        return sessionRepository.save(session);
    }

    /**
     * @return false if the member had no session
     */
    @Transactional
    public boolean endSession(String tenantId, String userId) {
        return sessionRepository.findByTenantIdAndUserId(tenantId, userId)
            .map(session -> {
                sessionRepository.delete(session);
                log.debug("VC session ended for {} in tenant {}", userId, tenantId);
                return true;
            })
            .orElse(false);
    }

    /**
     * Follow a member into another channel. Starts a session if there was none.
     */
    @Transactional
    public VcSession moveSession(String tenantId, String userId, String channelId, String categoryId, Instant now) {
        Optional<VcSession> existing = sessionRepository.findByTenantIdAndUserId(tenantId, userId);
        if (existing.isEmpty()) {
            return startSession(tenantId, userId, channelId, categoryId, now);
        }
        VcSession session = existing.get();
        session.setChannelId(channelId);
        session.setCategoryId(categoryId);
        return sessionRepository.save(session);
    }

    /**
     * Drop every session, e.g. before re-scanning voice presence.
     *
     * @return number of sessions removed
     */
    @Transactional
    public long clearSessions() {
        long count = sessionRepository.count();
        sessionRepository.deleteAllInBatch();
        log.info("Cleared {} VC sessions", count);
        return count;
    }

    @Transactional(readOnly = true)
    public List<VcSession> sessions(String tenantId) {
        return sessionRepository.findByTenantId(tenantId);
    }

    /**
     * Pay one minute of earnings to every session.
     *
     * @return number of sessions paid
     */
    public int payoutTick(Instant now) {
        LocalDate day = LocalDate.ofInstant(now, properties.getZone());
        long minute = now.getEpochSecond() / 60;
        int paid = 0;

        for (VcSession session : sessionRepository.findAllByOrderByStartedAtAsc()) {
            if (session.getCategoryId() == null) {
                continue;
            }
            List<VcEarningRate> rates = rateRepository.findByTenantIdAndCategoryId(
                session.getTenantId(), session.getCategoryId());
            if (rates.isEmpty()) {
                continue;
            }
            try {
                if (paySession(session, rates, day, minute, now)) {
                    paid++;
                }
            } catch (RuntimeException e) {
                log.error("VC payout failed for {} in tenant {}", session.getUserId(), session.getTenantId(), e);
            }
        }

        if (paid > 0) {
            log.info("VC payout tick at {} paid {} sessions", now, paid);
        }
        return paid;
    }

    @Transactional(readOnly = true)
    public BigDecimal dailyTotal(String tenantId, String userId, String symbol, LocalDate date) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        return dailyRepository.findByTenantIdAndUserIdAndAssetIdAndEarnedOn(tenantId, userId, asset.getId(), date)
            .map(VcEarningDaily::getTotal)
            .orElse(BigDecimal.ZERO);
    }

    /**
     * Delete daily totals older than the retention window.
     *
     * @return number of rows removed
     */
    @Transactional
    public int purgeDailyTotals(LocalDate today) {
        LocalDate cutoff = today.minusDays(properties.getVoice().getDailyRetentionDays());
        int removed = dailyRepository.deleteByEarnedOnBefore(cutoff);
        log.info("Purged {} VC daily totals before {}", removed, cutoff);
        return removed;
    }

    private boolean paySession(VcSession session, List<VcEarningRate> rates, LocalDate day, long minute,
                               Instant now) {
        String tenantId = session.getTenantId();
        FundingSource source = properties.getVoice().getFundingSource();
        String fundingId = accountDirectory.systemAccountId(tenantId,
            source == FundingSource.TREASURY ? AccountType.TREASURY : AccountType.MINT);
        String mintId = accountDirectory.systemAccountId(tenantId, AccountType.MINT);
        String userAccountId = accountDirectory.ensureUserAccount(tenantId, session.getUserId());

        List<String> lockKeys = new ArrayList<>();
        lockKeys.add("vc-session:" + session.getId());
        for (VcEarningRate rate : rates) {
            lockKeys.addAll(TreasuryService.lockKeys(fundingId, mintId, rate.getAssetId()));
            lockKeys.add(AccountLockManager.balanceKey(userAccountId, rate.getAssetId()));
        }

        Runnable refill = () -> {
            if (source == FundingSource.TREASURY) {
                rates.forEach(rate -> treasuryService.autoRefillTreasuryIfNeeded(
                    fundingId, rate.getAssetId(), tenantId, rate.getRatePerMinute()));
            }
        };

        return ledgerExecutor.execute("vc payout", lockKeys, refill, () -> {
            VcSession current = sessionRepository.findById(session.getId()).orElse(null);
            if (current == null) {
                return false;
            }
            boolean anyPaid = false;
            for (VcEarningRate rate : rates) {
                String key = IdempotencyKey.of("vc_earning", session.getId(), rate.getAssetId(), minute);
                if (transactionFactory.findExisting(TransactionKind.VC_EARNING, key).isPresent()) {
                    continue;
                }
                transactionFactory.record(JournalRequest.builder()
                    .kind(TransactionKind.VC_EARNING)
                    .idempotencyKey(key)
                    .reference("VC earning in channel " + current.getChannelId())
                    .move(fundingId, userAccountId, rate.getAssetId(), rate.getRatePerMinute())
                    .build());

                VcEarningDaily daily = dailyRepository.findByTenantIdAndUserIdAndAssetIdAndEarnedOn(
                        tenantId, current.getUserId(), rate.getAssetId(), day)
                    .orElseGet(() -> new VcEarningDaily(tenantId, current.getUserId(), rate.getAssetId(), day));
                daily.setTotal(daily.getTotal().add(rate.getRatePerMinute()));
                dailyRepository.save(daily);
                anyPaid = true;
            }
            current.setLastPaidAt(now);
            sessionRepository.save(current);
            return anyPaid;
        });
    }
}
