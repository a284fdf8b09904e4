package com.guildledger.payments;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetService;
import com.guildledger.ledger.AccountLockManager;
import com.guildledger.ledger.JournalRequest;
import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.ledger.LedgerService;
import com.guildledger.ledger.TransactionFactory;
import com.guildledger.ledger.TransactionKind;
import com.guildledger.ledger.TreasuryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Direct payments between members, issuance from the treasury and burning.
 *
 * User supplied amounts are truncated to the asset's precision, never rounded up.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentService {

    private final AssetService assetService;
    private final AccountDirectory accountDirectory;
    private final LedgerService ledgerService;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final TreasuryService treasuryService;

    /**
     * Pay another member.
     *
     * @throws com.guildledger.common.exception.InsufficientBalanceException if the sender cannot cover the amount
     */
    public PaymentReceipt transfer(String tenantId, String fromUserId, String toUserId, String symbol,
                                   BigDecimal amount, String memo) {
        if (fromUserId != null && fromUserId.equals(toUserId)) {
            throw new IllegalArgumentException("Cannot transfer to yourself");
        }
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal quantized = asset.truncatePositive(amount);
        String fromId = accountDirectory.ensureUserAccount(tenantId, fromUserId);
        String toId = accountDirectory.ensureUserAccount(tenantId, toUserId);

        List<String> lockKeys = List.of(
            AccountLockManager.balanceKey(fromId, asset.getId()),
            AccountLockManager.balanceKey(toId, asset.getId()));
        String transactionId = ledgerExecutor.execute("transfer", lockKeys, () ->
            transactionFactory.record(JournalRequest.builder()
                .kind(TransactionKind.TRANSFER)
                .createdBy(fromUserId)
                .reference(memo)
                .move(fromId, toId, asset.getId(), quantized)
                .build()));

        log.info("Transfer {} {} from {} to {} in tenant {}", quantized.toPlainString(), asset.getSymbol(),
            fromUserId, toUserId, tenantId);
        return new PaymentReceipt(transactionId, asset.getSymbol(), quantized);
    }

    /**
     * Pay a member from the treasury, refilling the treasury first if it cannot cover the amount.
     */
    public PaymentReceipt issue(String tenantId, String adminUserId, String toUserId, String symbol,
                                BigDecimal amount, String memo) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal quantized = asset.truncatePositive(amount);
        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
        String mintId = accountDirectory.systemAccountId(tenantId, AccountType.MINT);
        String toId = accountDirectory.ensureUserAccount(tenantId, toUserId);

        List<String> lockKeys = new ArrayList<>(TreasuryService.lockKeys(treasuryId, mintId, asset.getId()));
        lockKeys.add(AccountLockManager.balanceKey(toId, asset.getId()));
        String transactionId = ledgerExecutor.execute("issue", lockKeys,
            () -> treasuryService.autoRefillTreasuryIfNeeded(treasuryId, asset.getId(), tenantId, quantized),
            () -> transactionFactory.record(JournalRequest.builder()
                .kind(TransactionKind.ISSUE)
                .createdBy(adminUserId)
                .reference(memo)
                .move(treasuryId, toId, asset.getId(), quantized)
                .build()));

        log.info("Issued {} {} to {} in tenant {} by {}", quantized.toPlainString(), asset.getSymbol(),
            toUserId, tenantId, adminUserId);
        return new PaymentReceipt(transactionId, asset.getSymbol(), quantized);
    }

    /**
     * Remove funds from circulation by moving them to the burn account.
     */
    public PaymentReceipt burn(String tenantId, String userId, String symbol, BigDecimal amount) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal quantized = asset.truncatePositive(amount);
        String userAccountId = accountDirectory.ensureUserAccount(tenantId, userId);
        String burnId = accountDirectory.systemAccountId(tenantId, AccountType.BURN);

        List<String> lockKeys = List.of(
            AccountLockManager.balanceKey(userAccountId, asset.getId()),
            AccountLockManager.balanceKey(burnId, asset.getId()));
        String transactionId = ledgerExecutor.execute("burn", lockKeys, () ->
            transactionFactory.record(JournalRequest.builder()
                .kind(TransactionKind.BURN)
                .createdBy(userId)
                .reference("Burn " + quantized.toPlainString() + " " + asset.getSymbol())
                .move(userAccountId, burnId, asset.getId(), quantized)
                .build()));

        log.info("Burned {} {} from {} in tenant {}", quantized.toPlainString(), asset.getSymbol(), userId, tenantId);
        return new PaymentReceipt(transactionId, asset.getSymbol(), quantized);
    }

    /**
     * Wallet balance of a member; zero for members who never held the asset.
     */
    public BigDecimal balance(String tenantId, String userId, String symbol) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        return accountDirectory.findUserAccount(tenantId, userId)
            .map(account -> ledgerService.balanceOf(account.getId(), asset.getId()))
            .orElse(BigDecimal.ZERO);
    }

    public BigDecimal treasuryBalance(String tenantId, String symbol) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        String treasuryId = accountDirectory.systemAccountId(tenantId, AccountType.TREASURY);
        return ledgerService.balanceOf(treasuryId, asset.getId());
    }
}
