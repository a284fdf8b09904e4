package com.guildledger.ledger;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetRepository;
import com.guildledger.common.exception.AssetNotFoundException;
import com.guildledger.config.GuildLedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;

/**
 * Keeps every treasury funded.
 *
 * A treasury is topped up by a fixed quantum whenever it is empty or cannot
 * cover an upcoming debit. The refill is its own {@code auto_treasury_refill}
 * transaction, minted from the tenant's mint account, and commits independently
 * of whatever unit triggered it.
 */
@Service
@Slf4j
public class TreasuryService {

    private final LedgerService ledgerService;
    private final AccountDirectory accountDirectory;
    private final AssetRepository assetRepository;
    private final AccountLockManager lockManager;
    private final TransactionTemplate refillTemplate;
    private final BigDecimal refillQuantum;

    public TreasuryService(LedgerService ledgerService,
                           AccountDirectory accountDirectory,
                           AssetRepository assetRepository,
                           AccountLockManager lockManager,
                           PlatformTransactionManager transactionManager,
                           GuildLedgerProperties properties) {
        this.ledgerService = ledgerService;
        this.accountDirectory = accountDirectory;
        this.assetRepository = assetRepository;
        this.lockManager = lockManager;
        this.refillTemplate = new TransactionTemplate(transactionManager);
        this.refillTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.refillQuantum = properties.getTreasury().getRefillQuantum();
    }

    /**
     * Refill the treasury if its balance is not positive or is below {@code requiredAmount}.
     *
     * Serialized per (treasury, asset): concurrent callers that see the same
     * empty treasury cause exactly one refill, since each re-reads the balance
     * after acquiring the lock.
     *
     * @param requiredAmount amount about to be debited, or null to only refill an empty treasury
     * @return true if a refill was written
     */
    public boolean autoRefillTreasuryIfNeeded(String treasuryAccountId, String assetId, String tenantId,
                                              BigDecimal requiredAmount) {
        String mintAccountId = accountDirectory.systemAccountId(tenantId, AccountType.MINT);
        Asset asset = assetRepository.findById(assetId)
            .orElseThrow(() -> new AssetNotFoundException(assetId));

        try (AccountLockManager.Held ignored = lockManager.acquire(lockKeys(treasuryAccountId, mintAccountId, assetId))) {
            Boolean refilled = refillTemplate.execute(status -> {
                BigDecimal balance = ledgerService.lockedBalanceOf(treasuryAccountId, assetId);
                if (!needsRefill(balance, requiredAmount)) {
                    return false;
                }
                BigDecimal quantum = asset.quantizeDown(refillQuantum);
                String transactionId = ledgerService.newTransaction(TransactionKind.AUTO_TREASURY_REFILL, null, null,
                    "Auto refill " + quantum.toPlainString() + " " + asset.getSymbol());
                ledgerService.postEntry(transactionId, mintAccountId, assetId, quantum.negate());
                ledgerService.postEntry(transactionId, treasuryAccountId, assetId, quantum);
                log.info("Auto refilled treasury {} with {} {} (balance was {})",
                    treasuryAccountId, quantum.toPlainString(), asset.getSymbol(), balance.toPlainString());
                return true;
            });
            return Boolean.TRUE.equals(refilled);
        }
    }

    /**
     * Refill the tenant's treasury for an asset, looked up by tenant.
     */
    public boolean autoRefillTreasuryIfNeeded(String tenantId, String assetId, BigDecimal requiredAmount) {
        String treasuryAccountId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
        return autoRefillTreasuryIfNeeded(treasuryAccountId, assetId, tenantId, requiredAmount);
    }

    /**
     * Keys a unit must hold when it may refill the treasury before debiting it.
     */
    public static List<String> lockKeys(String treasuryAccountId, String mintAccountId, String assetId) {
        return List.of(
            AccountLockManager.balanceKey(treasuryAccountId, assetId),
            AccountLockManager.balanceKey(mintAccountId, assetId));
    }

    static boolean needsRefill(BigDecimal balance, BigDecimal requiredAmount) {
        if (balance.signum() <= 0) {
            return true;
        }
        return requiredAmount != null && requiredAmount.compareTo(balance) > 0;
    }
}
