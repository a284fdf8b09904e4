package com.guildledger.rewards;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetService;
import com.guildledger.common.IdempotencyKey;
import com.guildledger.common.exception.DuplicateClaimException;
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
import java.util.List;
import java.util.Optional;

/**
 * Message-triggered one-time rewards.
 *
 * When a member posts the trigger message in a configured channel, the
 * treasury pays them once. The payment and the claim record are written in the
 * same unit; a member who already claimed gets a {@link DuplicateClaimException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoRewardService {

    private final AutoRewardConfigRepository configRepository;
    private final AutoRewardClaimRepository claimRepository;
    private final AssetService assetService;
    private final AccountDirectory accountDirectory;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final TreasuryService treasuryService;
    private final Clock clock;

    /**
     * Create or replace the reward of a channel. Existing claims stay valid.
     */
    public AutoRewardConfig configure(String tenantId, String channelId, String triggerMessage, String symbol,
                                      BigDecimal amount) {
        if (triggerMessage == null || triggerMessage.isBlank()) {
            throw new IllegalArgumentException("Trigger message cannot be blank");
        }
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal truncated = asset.truncatePositive(amount);
        String trigger = triggerMessage.strip();

        AutoRewardConfig config = ledgerExecutor.execute("configure auto reward", List.of(channelKey(tenantId, channelId)), () -> {
            AutoRewardConfig existing = configRepository.findByTenantIdAndChannelId(tenantId, channelId)
                .orElse(null);
            if (existing == null) {
                return configRepository.save(new AutoRewardConfig(tenantId, channelId, trigger, truncated, asset.getId()));
            }
            existing.setTriggerMessage(trigger);
            existing.setAmount(truncated);
            existing.setAssetId(asset.getId());
            return configRepository.save(existing);
        });

        log.info("Auto reward for channel {} in tenant {}: {} {} on '{}'", channelId, tenantId,
            truncated.toPlainString(), asset.getSymbol(), trigger);
        return config;
    }

    @Transactional
    public boolean enable(String tenantId, String channelId) {
        return setEnabled(tenantId, channelId, true);
    }

    @Transactional
    public boolean disable(String tenantId, String channelId) {
        return setEnabled(tenantId, channelId, false);
    }

    /**
     * Remove a channel's reward and its claims.
     *
     * @return false if the channel had no reward
     */
    @Transactional
    public boolean remove(String tenantId, String channelId) {
        Optional<AutoRewardConfig> config = configRepository.findByTenantIdAndChannelId(tenantId, channelId);
        if (config.isEmpty()) {
            return false;
        }
        int claims = claimRepository.deleteByConfigIdIn(List.of(config.get().getId()));
        configRepository.delete(config.get());
        log.info("Removed auto reward for channel {} in tenant {} with {} claims", channelId, tenantId, claims);
        return true;
    }

    @Transactional(readOnly = true)
    public List<AutoRewardConfig> list(String tenantId) {
        return configRepository.findByTenantIdOrderByCreatedAtAsc(tenantId);
    }

    /**
     * Pay the channel's reward if the message matches its trigger.
     *
     * @return the payout, or empty when the channel has no enabled reward or the message does not match
     * @throws DuplicateClaimException if the member already received this reward
     */
    public Optional<AutoRewardPayout> onMessage(String tenantId, String channelId, String userId, String content) {
        Optional<AutoRewardConfig> match = configRepository.findByTenantIdAndChannelId(tenantId, channelId)
            .filter(AutoRewardConfig::isEnabled)
            .filter(config -> config.matches(content));
        if (match.isEmpty()) {
            return Optional.empty();
        }

        AutoRewardConfig config = match.get();
        if (claimRepository.existsByConfigIdAndUserId(config.getId(), userId)) {
            throw new DuplicateClaimException(config.getId(), userId);
        }

        Asset asset = assetService.getAssetById(config.getAssetId());
        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
        String mintId = accountDirectory.systemAccountId(tenantId, AccountType.MINT);
        String userAccountId = accountDirectory.ensureUserAccount(tenantId, userId);
        BigDecimal amount = config.getAmount();

        List<String> lockKeys = new ArrayList<>(TreasuryService.lockKeys(treasuryId, mintId, asset.getId()));
        lockKeys.add(AccountLockManager.balanceKey(userAccountId, asset.getId()));
        lockKeys.add("auto-reward:" + config.getId() + ":" + userId);

        String transactionId = ledgerExecutor.execute("auto reward", lockKeys,
            () -> treasuryService.autoRefillTreasuryIfNeeded(treasuryId, asset.getId(), tenantId, amount),
            () -> {
                if (claimRepository.existsByConfigIdAndUserId(config.getId(), userId)) {
                    throw new DuplicateClaimException(config.getId(), userId);
                }
                String txId = transactionFactory.record(JournalRequest.builder()
                    .kind(TransactionKind.AUTO_REWARD)
                    .createdBy(userId)
                    .idempotencyKey(IdempotencyKey.of("auto_reward", config.getId(), userId))
                    .reference("Auto reward in channel " + channelId)
                    .move(treasuryId, userAccountId, asset.getId(), amount)
                    .build());
                claimRepository.save(new AutoRewardClaim(config.getId(), userId, txId, clock.instant()));
                return txId;
            });

        log.info("Auto reward {} {} paid to {} in channel {} of tenant {}", amount.toPlainString(),
            asset.getSymbol(), userId, channelId, tenantId);
        return Optional.of(new AutoRewardPayout(config.getId(), userId, asset.getSymbol(), amount, transactionId));
    }

    private boolean setEnabled(String tenantId, String channelId, boolean enabled) {
        return configRepository.findByTenantIdAndChannelId(tenantId, channelId)
            .map(config -> {
                config.setEnabled(enabled);
                configRepository.save(config);
                log.info("Auto reward for channel {} in tenant {} {}", channelId, tenantId,
                    enabled ? "enabled" : "disabled");
                return true;
            })
            .orElse(false);
    }

    private static String channelKey(String tenantId, String channelId) {
        return "auto-reward-channel:" + tenantId + ":" + channelId;
    }
}
