package com.guildledger.assets;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.common.exception.AssetNotFoundException;
import com.guildledger.common.exception.DuplicateAssetException;
import com.guildledger.config.GuildLedgerProperties;
import com.guildledger.ledger.JournalRequest;
import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.ledger.LedgerService;
import com.guildledger.ledger.TransactionFactory;
import com.guildledger.ledger.TransactionKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of currencies per tenant.
 *
 * Creating a currency also prepares the tenant's system accounts and issues
 * the initial treasury supply in the same unit. Deleting a currency removes
 * every row that references it, across the ledger and all subledgers, in one
 * transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetService {

    private final AssetRepository assetRepository;
    private final AccountDirectory accountDirectory;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final LedgerService ledgerService;
    private final List<AssetCascade> cascades;
    private final GuildLedgerProperties properties;

    /**
     * Create a currency.
     *
     * @return the asset id
     * @throws DuplicateAssetException if the symbol is already used in the tenant
     */
    public String createAsset(String tenantId, String symbol, String name, int decimals) {
        String normalized = Asset.normalizeSymbol(symbol);
        String displayName = name == null || name.isBlank() ? normalized : name.strip();

        accountDirectory.ensureSystemAccounts(tenantId);
        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
        String mintId = accountDirectory.systemAccountId(tenantId, AccountType.MINT);

        return ledgerExecutor.execute("create asset " + normalized, List.of(assetKey(tenantId, normalized)), () -> {
            if (assetRepository.existsByTenantIdAndSymbol(tenantId, normalized)) {
                throw new DuplicateAssetException(tenantId, normalized);
            }
            Asset asset = assetRepository.saveAndFlush(new Asset(tenantId, normalized, displayName, decimals));

            BigDecimal initialIssue = asset.quantizeDown(properties.getTreasury().getInitialIssue());
            if (initialIssue.signum() > 0) {
                transactionFactory.record(JournalRequest.builder()
                    .kind(TransactionKind.INITIAL_ISSUE)
                    .reference("Initial issue " + initialIssue.toPlainString() + " " + normalized)
                    .move(mintId, treasuryId, asset.getId(), initialIssue)
                    .build());
            }

            log.info("Created asset {} ({} decimals) in tenant {}: id={}", normalized, decimals, tenantId, asset.getId());
            return asset.getId();
        });
    }

    @Transactional(readOnly = true)
    public Asset getAsset(String tenantId, String symbol) {
        String normalized = Asset.normalizeSymbol(symbol);
        return assetRepository.findByTenantIdAndSymbol(tenantId, normalized)
            .orElseThrow(() -> new AssetNotFoundException(tenantId, normalized));
    }

    @Transactional(readOnly = true)
    public Optional<Asset> findAsset(String tenantId, String symbol) {
        return assetRepository.findByTenantIdAndSymbol(tenantId, Asset.normalizeSymbol(symbol));
    }

    @Transactional(readOnly = true)
    public Asset getAssetById(String assetId) {
        return assetRepository.findById(assetId)
            .orElseThrow(() -> new AssetNotFoundException(assetId));
    }

    @Transactional(readOnly = true)
    public List<Asset> listAssets(String tenantId) {
        return assetRepository.findByTenantIdOrderBySymbolAsc(tenantId);
    }

    /**
     * Delete a currency with everything that references it.
     *
     * Any failure rolls back the whole cascade.
     *
     * @return rows removed per table
     */
    public AssetDeletionSummary deleteAsset(String tenantId, String symbol) {
        String normalized = Asset.normalizeSymbol(symbol);
        return ledgerExecutor.execute("delete asset " + normalized, List.of(assetKey(tenantId, normalized)), () -> {
            Asset asset = getAsset(tenantId, normalized);

            Map<String, Long> deleted = new LinkedHashMap<>();
            for (AssetCascade cascade : cascades) {
                cascade.deleteByAsset(asset).forEach((table, rows) -> deleted.merge(table, rows, Long::sum));
            }
            deleted.putAll(ledgerService.deleteAsset(asset.getId()));
            assetRepository.delete(asset);
            deleted.put("assets", 1L);

            log.info("Deleted asset {} from tenant {}: {}", normalized, tenantId, deleted);
            return new AssetDeletionSummary(asset.getId(), normalized, deleted);
        });
    }

    private static String assetKey(String tenantId, String symbol) {
        return "asset:" + tenantId + ":" + symbol;
    }
}
