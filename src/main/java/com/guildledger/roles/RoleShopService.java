package com.guildledger.roles;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetService;
import com.guildledger.ledger.AccountLockManager;
import com.guildledger.ledger.JournalRequest;
import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.ledger.TransactionFactory;
import com.guildledger.ledger.TransactionKind;
import com.guildledger.providers.RoleGrantGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Role panels, their plans and role purchases.
 *
 * A purchase pays the plan's price to the treasury and records the purchase in
 * one unit; the role is granted once that unit has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoleShopService {

    private final RolePanelRepository panelRepository;
    private final RolePlanRepository planRepository;
    private final RolePurchaseRepository purchaseRepository;
    private final AssetService assetService;
    private final AccountDirectory accountDirectory;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final RoleGrantGateway roleGrantGateway;
    private final Clock clock;

    @Transactional
    public RolePanel createPanel(String tenantId, int panelNumber, String name, String roleId, String symbol) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        if (panelRepository.findByTenantIdAndPanelNumber(tenantId, panelNumber).isPresent()) {
            throw new IllegalStateException(String.format(
                "Panel %d already exists in tenant %s", panelNumber, tenantId));
        }
        RolePanel panel = panelRepository.save(new RolePanel(tenantId, panelNumber, name, roleId, asset.getId()));
        log.info("Created role panel {} ({}) in tenant {}", panelNumber, panel.getId(), tenantId);
        return panel;
    }

    /**
     * Add a plan to a panel. The plan is priced in the panel's currency.
     */
    @Transactional
    public RolePlan addPlan(String panelId, String name, String roleId, BigDecimal price, int durationHours,
                            String description) {
        RolePanel panel = getPanel(panelId);
        Asset asset = assetService.getAssetById(panel.getAssetId());
        if (durationHours <= 0) {
            throw new IllegalArgumentException("Duration must be at least one hour");
        }
        if (roleId == null || roleId.isBlank()) {
            throw new IllegalArgumentException("Plan must grant a role");
        }
        RolePlan plan = planRepository.save(new RolePlan(panel.getId(), name, roleId,
            asset.truncatePositive(price), asset.getId(), durationHours, description));
        log.info("Added plan {} to panel {}: role {} for {} {} / {}h", plan.getId(), panelId, roleId,
            plan.getPrice().toPlainString(), asset.getSymbol(), durationHours);
        return plan;
    }

    @Transactional(readOnly = true)
    public List<RolePanel> panels(String tenantId) {
        return panelRepository.findByTenantIdOrderByPanelNumberAsc(tenantId);
    }

    @Transactional(readOnly = true)
    public List<RolePlan> plans(String panelId) {
        return planRepository.findByPanelIdOrderByNameAsc(getPanel(panelId).getId());
    }

    @Transactional(readOnly = true)
    public List<RolePurchase> purchasesOf(String tenantId, String userId) {
        return purchaseRepository.findByTenantIdAndUserIdOrderByExpiresAtAsc(tenantId, userId);
    }

    /**
     * Run the action behind an action id on behalf of a member.
     */
    public RoleActionResult invoke(String tenantId, String userId, String actionId) {
        RoleAction action = RoleAction.parse(actionId);
        return switch (action.getType()) {
            case SHOW_PLANS -> {
                RolePanel panel = getPanel(action.getTargetId());
                requireTenant(panel.getTenantId(), tenantId, actionId);
                yield RoleActionResult.plans(action, plans(panel.getId()));
            }
            case PURCHASE -> RoleActionResult.purchased(action, purchase(tenantId, userId, action.getTargetId()));
        };
    }

    /**
     * Buy a plan and grant its role.
     *
     * @throws com.guildledger.common.exception.InsufficientBalanceException if the member cannot pay the price
     */
    public RolePurchase purchase(String tenantId, String userId, String planId) {
        RolePlan plan = planRepository.findById(planId)
            .orElseThrow(() -> new IllegalArgumentException("Role plan not found: " + planId));
        requireTenant(getPanel(plan.getPanelId()).getTenantId(), tenantId, planId);
        String buyerId = accountDirectory.ensureUserAccount(tenantId, userId);
        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);

        List<String> lockKeys = List.of(
            AccountLockManager.balanceKey(buyerId, plan.getAssetId()),
            AccountLockManager.balanceKey(treasuryId, plan.getAssetId()));
        RolePurchase purchase = ledgerExecutor.execute("role purchase", lockKeys, () -> {
            String transactionId = transactionFactory.record(JournalRequest.builder()
                .kind(TransactionKind.ROLE_PURCHASE)
                .createdBy(userId)
                .reference("Role purchase: " + plan.getName())
                .move(buyerId, treasuryId, plan.getAssetId(), plan.getPrice())
                .build());
            return purchaseRepository.save(new RolePurchase(tenantId, userId, plan, transactionId, clock.instant()));
        });

        roleGrantGateway.grantRole(tenantId, userId, plan.getRoleId());
        log.info("User {} bought role {} in tenant {} until {}", userId, plan.getRoleId(), tenantId,
            purchase.getExpiresAt());
        return purchase;
    }

    private RolePanel getPanel(String panelId) {
        return panelRepository.findById(panelId)
            .orElseThrow(() -> new IllegalArgumentException("Role panel not found: " + panelId));
    }

    private static void requireTenant(String owner, String tenantId, String ref) {
        if (!owner.equals(tenantId)) {
            throw new IllegalArgumentException(String.format("%s does not belong to tenant %s", ref, tenantId));
        }
    }
}
