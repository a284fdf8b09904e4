package com.guildledger.voice;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetService;
import com.guildledger.ledger.AccountLockManager;
import com.guildledger.ledger.JournalRequest;
import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.ledger.TransactionFactory;
import com.guildledger.ledger.TransactionKind;
import com.guildledger.providers.GuildMemberDirectory;
import com.guildledger.providers.VoiceChannelGateway;
import com.guildledger.providers.VoiceChannelSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Voice channels members pay to open for a limited time.
 *
 * Opening a channel creates it on the platform first, then pays the plan's
 * price to the treasury and records the channel in one unit. If that unit
 * fails the channel is deleted again, so a member never keeps a channel they
 * did not pay for and never pays for a channel that was not created.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VcCreatorService {

    private final VcCreationPlanRepository planRepository;
    private final VcCreationRepository creationRepository;
    private final AssetService assetService;
    private final AccountDirectory accountDirectory;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final VoiceChannelGateway voiceChannelGateway;
    private final GuildMemberDirectory memberDirectory;
    private final Clock clock;

    /**
     * Add a plan. A price of zero makes the channel free for everyone.
     */
    @Transactional
    public VcCreationPlan addPlan(String tenantId, VcPlanRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("Plan name cannot be blank");
        }
        if (request.getTemplateName() == null || request.getTemplateName().isBlank()) {
            throw new IllegalArgumentException("Template name cannot be blank");
        }
        if (request.getChannelNameTemplate() == null || request.getChannelNameTemplate().isBlank()) {
            throw new IllegalArgumentException("Channel name cannot be blank");
        }
        if (request.getDurationHours() <= 0) {
            throw new IllegalArgumentException("Duration must be at least one hour");
        }
        if (request.getUserLimit() < 0) {
            throw new IllegalArgumentException("User limit cannot be negative: " + request.getUserLimit());
        }
        if (request.getAccess() == null) {
            throw new IllegalArgumentException("Channel access is required");
        }
        Asset asset = assetService.getAsset(tenantId, request.getSymbol());
        BigDecimal price = priceOf(asset, request.getPrice());
        if (planRepository.findByTenantIdAndName(tenantId, request.getName()).isPresent()) {
            throw new IllegalStateException(String.format(
                "VC plan %s already exists in tenant %s", request.getName(), tenantId));
        }

        VcCreationPlan plan = planRepository.save(new VcCreationPlan(tenantId, request, price, asset.getId()));
        log.info("Added VC plan {} ({}) in tenant {}: {} {} / {}h, {}", plan.getName(), plan.getId(), tenantId,
            price.toPlainString(), asset.getSymbol(), plan.getDurationHours(), plan.getAccess().getCode());
        return plan;
    }

    @Transactional
    public boolean removePlan(String tenantId, String planId) {
        return planRepository.findById(planId)
            .filter(plan -> plan.getTenantId().equals(tenantId))
            .map(plan -> {
                planRepository.delete(plan);
                log.info("Removed VC plan {} ({}) from tenant {}", plan.getName(), planId, tenantId);
                return true;
            })
            .orElse(false);
    }

    @Transactional(readOnly = true)
    public List<VcCreationPlan> plans(String tenantId) {
        return planRepository.findByTenantIdOrderByTemplateNameAscNameAsc(tenantId);
    }

    @Transactional(readOnly = true)
    public List<VcCreationPlan> plans(String tenantId, String templateName) {
        return planRepository.findByTenantIdAndTemplateNameOrderByNameAsc(tenantId, templateName);
    }

    @Transactional(readOnly = true)
    public List<VcCreation> channelsOf(String tenantId, String userId) {
        return creationRepository.findByTenantIdAndOwnerUserIdOrderByExpiresAtAsc(tenantId, userId);
    }

    /**
     * Open a channel from a plan on behalf of a member.
     *
     * @param displayName substituted into the plan's channel name
     * @throws com.guildledger.common.exception.InsufficientBalanceException if the member cannot pay the price
     */
    public VcCreation create(String tenantId, String userId, String displayName, String planId) {
        VcCreationPlan plan = planRepository.findById(planId)
            .filter(p -> p.getTenantId().equals(tenantId))
            .orElseThrow(() -> new IllegalArgumentException(String.format(
                "VC plan %s not found in tenant %s", planId, tenantId)));
        boolean charged = plan.getPrice().signum() > 0 && !holdsFreeRole(tenantId, userId, plan);
        String buyerId = accountDirectory.ensureUserAccount(tenantId, userId);
        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);

        String channelId = voiceChannelGateway.createChannel(tenantId, new VoiceChannelSpec(userId,
            plan.channelName(displayName), plan.getCategoryId(), plan.getUserLimit(), plan.getAccess()));

        List<String> lockKeys = List.of(
            AccountLockManager.balanceKey(buyerId, plan.getAssetId()),
            AccountLockManager.balanceKey(treasuryId, plan.getAssetId()));
        VcCreation creation;
        try {
            creation = ledgerExecutor.execute("vc creation", lockKeys, () -> {
                String transactionId = null;
                if (charged) {
                    transactionId = transactionFactory.record(JournalRequest.builder()
                        .kind(TransactionKind.VC_CREATION)
                        .createdBy(userId)
                        .reference("VC creation: " + plan.getName())
                        .move(buyerId, treasuryId, plan.getAssetId(), plan.getPrice())
                        .build());
                }
                BigDecimal paid = charged ? plan.getPrice() : BigDecimal.ZERO;
                return creationRepository.save(new VcCreation(tenantId, userId, plan, channelId, paid,
                    transactionId, clock.instant()));
            });
        } catch (RuntimeException e) {
            closeChannel(tenantId, channelId);
            throw e;
        }

        log.info("User {} opened voice channel {} from plan {} in tenant {} until {}{}", userId, channelId,
            plan.getName(), tenantId, creation.getExpiresAt(), charged ? "" : " (free)");
        return creation;
    }

    /**
     * Delete every channel with {@code expiresAt <= now}, one short unit per record.
     *
     * A platform failure is logged and the record is removed anyway.
     *
     * @return number of records removed
     */
    public int sweepExpired(Instant now) {
        List<VcCreation> expired = creationRepository.findByExpiresAtLessThanEqualOrderByExpiresAtAsc(now);
        int removed = 0;
        for (VcCreation creation : expired) {
            closeChannel(creation.getTenantId(), creation.getChannelId());
            try {
                boolean deleted = ledgerExecutor.execute("expire vc creation",
                    List.of("vc-creation:" + creation.getId()), () -> {
                        if (!creationRepository.existsById(creation.getId())) {
                            return false;
                        }
                        creationRepository.deleteById(creation.getId());
                        return true;
                    });
                if (deleted) {
                    removed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to remove expired voice channel record {}", creation.getId(), e);
            }
        }

        if (!expired.isEmpty()) {
            log.info("VC creation sweep removed {} of {} expired channels", removed, expired.size());
        }
        return removed;
    }

    private boolean holdsFreeRole(String tenantId, String userId, VcCreationPlan plan) {
        return plan.getFreeRoleId() != null
            && memberDirectory.membersWithRole(tenantId, plan.getFreeRoleId()).contains(userId);
    }

    private void closeChannel(String tenantId, String channelId) {
        try {
            voiceChannelGateway.deleteChannel(tenantId, channelId);
        } catch (RuntimeException e) {
            log.warn("Could not delete voice channel {} in tenant {}: {}", channelId, tenantId, e.getMessage());
        }
    }

    private static BigDecimal priceOf(Asset asset, BigDecimal price) {
        if (price == null || price.signum() < 0) {
            throw new IllegalArgumentException("Price cannot be negative: " + price);
        }
        return price.signum() == 0 ? BigDecimal.ZERO : asset.truncatePositive(price);
    }
}
