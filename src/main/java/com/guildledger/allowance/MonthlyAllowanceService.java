package com.guildledger.allowance;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetService;
import com.guildledger.common.IdempotencyKey;
import com.guildledger.ledger.AccountLockManager;
import com.guildledger.ledger.JournalRequest;
import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.ledger.TransactionFactory;
import com.guildledger.ledger.TransactionKind;
import com.guildledger.ledger.TreasuryService;
import com.guildledger.providers.GuildMemberDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Monthly payroll per role.
 *
 * Each member payment is its own unit guarded twice against double payment:
 * by the history row for (tenant, role, member, asset, month) and by the
 * idempotency key of its ledger transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonthlyAllowanceService {

    private final MonthlyAllowanceRepository allowanceRepository;
    private final MonthlyAllowanceHistoryRepository historyRepository;
    private final AssetService assetService;
    private final AccountDirectory accountDirectory;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final TreasuryService treasuryService;
    private final GuildMemberDirectory memberDirectory;
    private final Clock clock;

    /**
     * Create or update the allowance of a role in one currency.
     */
    @Transactional
    public MonthlyAllowance configure(String tenantId, String roleId, String symbol, BigDecimal amount) {
        if (roleId == null || roleId.isBlank()) {
            throw new IllegalArgumentException("Role id cannot be blank");
        }
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal truncated = asset.truncatePositive(amount);
        MonthlyAllowance allowance = allowanceRepository.findByTenantIdAndRoleIdAndAssetId(tenantId, roleId, asset.getId())
            .map(existing -> {
                existing.setAmount(truncated);
                return existing;
            })
            .orElseGet(() -> new MonthlyAllowance(tenantId, roleId, asset.getId(), truncated));
        log.info("Monthly allowance for role {} in tenant {}: {} {}", roleId, tenantId,
            truncated.toPlainString(), asset.getSymbol());
        return allowanceRepository.save(allowance);
    }

    @Transactional
    public boolean remove(String tenantId, String roleId, String symbol) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        return allowanceRepository.findByTenantIdAndRoleIdAndAssetId(tenantId, roleId, asset.getId())
            .map(allowance -> {
                allowanceRepository.delete(allowance);
                log.info("Removed monthly allowance for role {} in tenant {} ({})", roleId, tenantId, symbol);
                return true;
            })
            .orElse(false);
    }

    @Transactional
    public boolean enable(String tenantId, String roleId, String symbol) {
        return setEnabled(tenantId, roleId, symbol, true);
    }

    @Transactional
    public boolean disable(String tenantId, String roleId, String symbol) {
        return setEnabled(tenantId, roleId, symbol, false);
    }

    @Transactional(readOnly = true)
    public List<MonthlyAllowance> list(String tenantId) {
        return allowanceRepository.findByTenantIdOrderByCreatedAtAsc(tenantId);
    }

    @Transactional(readOnly = true)
    public List<MonthlyAllowanceHistory> history(String tenantId, YearMonth yearMonth) {
        return historyRepository.findByTenantIdAndYearMonthOrderByPaidAtAsc(tenantId, yearMonth.toString());
    }

    /**
     * Pay every enabled allowance to every member currently holding its role.
     *
     * Members already paid for the month are skipped. A failing member is
     * logged and does not stop the run.
     */
    public AllowanceRunSummary executeMonth(YearMonth yearMonth) {
        List<MonthlyAllowance> allowances = allowanceRepository.findByEnabledTrue();
        int paid = 0;
        int alreadyPaid = 0;
        int failed = 0;

        for (MonthlyAllowance allowance : allowances) {
            List<String> members = memberDirectory.membersWithRole(allowance.getTenantId(), allowance.getRoleId());
            for (String userId : members) {
                try {
                    if (payMember(allowance, userId, yearMonth)) {
                        paid++;
                    } else {
                        alreadyPaid++;
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Monthly allowance {} for {} in tenant {} failed for {}", allowance.getId(), userId,
                        allowance.getTenantId(), yearMonth, e);
                }
            }
        }

        AllowanceRunSummary summary = new AllowanceRunSummary(yearMonth, paid, alreadyPaid, failed);
        log.info("Monthly allowance run for {}: {} paid, {} already paid, {} failed",
            yearMonth, paid, alreadyPaid, failed);
        return summary;
    }

    /**
     * Pay one member's allowance for a month.
     *
     * @return false if the member was already paid for that month
     */
    public boolean payMember(MonthlyAllowance allowance, String userId, YearMonth yearMonth) {
        String tenantId = allowance.getTenantId();
        String assetId = allowance.getAssetId();
        String month = yearMonth.toString();
        String key = IdempotencyKey.of("allowance", tenantId, allowance.getRoleId(), userId, assetId, month);

        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
        String mintId = accountDirectory.systemAccountId(tenantId, AccountType.MINT);
        String userAccountId = accountDirectory.ensureUserAccount(tenantId, userId);

        List<String> lockKeys = new ArrayList<>(TreasuryService.lockKeys(treasuryId, mintId, assetId));
        lockKeys.add(AccountLockManager.balanceKey(userAccountId, assetId));
        lockKeys.add(key);

        return ledgerExecutor.execute("monthly allowance", lockKeys,
            () -> treasuryService.autoRefillTreasuryIfNeeded(treasuryId, assetId, tenantId, allowance.getAmount()),
            () -> {
                if (historyRepository.existsByTenantIdAndRoleIdAndUserIdAndAssetIdAndYearMonth(
                    tenantId, allowance.getRoleId(), userId, assetId, month)) {
                    log.debug("Allowance {} already paid to {} for {}", allowance.getId(), userId, month);
                    return false;
                }
                String transactionId = transactionFactory.record(JournalRequest.builder()
                    .kind(TransactionKind.MONTHLY_ALLOWANCE)
                    .idempotencyKey(key)
                    .reference("Monthly allowance " + month + " for role " + allowance.getRoleId())
                    .move(treasuryId, userAccountId, assetId, allowance.getAmount())
                    .build());
                historyRepository.save(new MonthlyAllowanceHistory(allowance, userId, month, transactionId,
                    clock.instant()));
                return true;
            });
    }

    private boolean setEnabled(String tenantId, String roleId, String symbol, boolean enabled) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        return allowanceRepository.findByTenantIdAndRoleIdAndAssetId(tenantId, roleId, asset.getId())
            .map(allowance -> {
                allowance.setEnabled(enabled);
                allowanceRepository.save(allowance);
                return true;
            })
            .orElse(false);
    }
}
