package com.guildledger.bank;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.accounts.AccountType;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetService;
import com.guildledger.common.exception.InsufficientBalanceException;
import com.guildledger.ledger.AccountLockManager;
import com.guildledger.ledger.JournalRequest;
import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.ledger.LedgerService;
import com.guildledger.ledger.TransactionFactory;
import com.guildledger.ledger.TransactionKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Savings kept apart from the wallet.
 *
 * Deposits and withdrawals are ledger transfers between the member's account
 * and the tenant's bank account; the member's share is tracked in
 * {@link BankAccount} and every movement is written to the bank history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankService {

    private final BankAccountRepository bankAccountRepository;
    private final BankTransactionRepository bankTransactionRepository;
    private final AssetService assetService;
    private final AccountDirectory accountDirectory;
    private final LedgerService ledgerService;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final Clock clock;

    /**
     * Move funds from the wallet into the bank.
     *
     * @throws InsufficientBalanceException if the wallet cannot cover the amount
     */
    public BankTransaction deposit(String tenantId, String userId, String symbol, BigDecimal amount) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal truncated = asset.truncatePositive(amount);
        String walletId = accountDirectory.ensureUserAccount(tenantId, userId);
        String bankId = accountDirectory.systemAccountId(tenantId, AccountType.BANK);

        BankTransaction entry = ledgerExecutor.execute("bank deposit", lockKeys(walletId, bankId, asset), () -> {
            String transactionId = transactionFactory.record(JournalRequest.builder()
                .kind(TransactionKind.BANK_DEPOSIT)
                .createdBy(userId)
                .reference("Bank deposit " + truncated.toPlainString() + " " + asset.getSymbol())
                .move(walletId, bankId, asset.getId(), truncated)
                .build());

            BankAccount account = bankAccountRepository.findByUserIdAndAssetId(userId, asset.getId())
                .orElseGet(() -> new BankAccount(tenantId, userId, asset.getId()));
            account.setBalance(account.getBalance().add(truncated));
            account.setUpdatedAt(clock.instant());
            bankAccountRepository.save(account);
            return bankTransactionRepository.save(new BankTransaction(
                account, BankTransactionType.DEPOSIT, truncated, transactionId, clock.instant()));
        });

        log.info("Bank deposit of {} {} by {} in tenant {}, bank balance now {}", truncated.toPlainString(),
            asset.getSymbol(), userId, tenantId, entry.getBalanceAfter().toPlainString());
        return entry;
    }

    /**
     * Move funds from the bank back into the wallet.
     *
     * @throws InsufficientBalanceException if the member's bank balance cannot cover the amount
     */
    public BankTransaction withdraw(String tenantId, String userId, String symbol, BigDecimal amount) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal truncated = asset.truncatePositive(amount);
        String walletId = accountDirectory.ensureUserAccount(tenantId, userId);
        String bankId = accountDirectory.systemAccountId(tenantId, AccountType.BANK);

        BankTransaction entry = ledgerExecutor.execute("bank withdraw", lockKeys(walletId, bankId, asset), () -> {
            BankAccount account = bankAccountRepository.findByUserIdAndAssetId(userId, asset.getId())
                .orElseGet(() -> new BankAccount(tenantId, userId, asset.getId()));
            if (account.getBalance().compareTo(truncated) < 0) {
                throw new InsufficientBalanceException(account.getId(), asset.getSymbol(), truncated,
                    account.getBalance());
            }

            String transactionId = transactionFactory.record(JournalRequest.builder()
                .kind(TransactionKind.BANK_WITHDRAW)
                .createdBy(userId)
                .reference("Bank withdraw " + truncated.toPlainString() + " " + asset.getSymbol())
                .move(bankId, walletId, asset.getId(), truncated)
                .build());

            account.setBalance(account.getBalance().subtract(truncated));
            account.setUpdatedAt(clock.instant());
            bankAccountRepository.save(account);
            return bankTransactionRepository.save(new BankTransaction(
                account, BankTransactionType.WITHDRAW, truncated, transactionId, clock.instant()));
        });

        log.info("Bank withdrawal of {} {} by {} in tenant {}, bank balance now {}", truncated.toPlainString(),
            asset.getSymbol(), userId, tenantId, entry.getBalanceAfter().toPlainString());
        return entry;
    }

    @Transactional(readOnly = true)
    public BankStatement statement(String tenantId, String userId, String symbol) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal wallet = accountDirectory.findUserAccount(tenantId, userId)
            .map(account -> ledgerService.balanceOf(account.getId(), asset.getId()))
            .orElse(BigDecimal.ZERO);
        BigDecimal bank = bankAccountRepository.findByUserIdAndAssetId(userId, asset.getId())
            .map(BankAccount::getBalance)
            .orElse(BigDecimal.ZERO);
        return new BankStatement(asset.getSymbol(), wallet, bank);
    }

    /**
     * Most recent bank movements first.
     */
    @Transactional(readOnly = true)
    public List<BankTransaction> history(String tenantId, String userId, String symbol, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        Asset asset = assetService.getAsset(tenantId, symbol);
        return bankTransactionRepository.findByTenantIdAndUserIdAndAssetIdOrderByCreatedAtDesc(
            tenantId, userId, asset.getId(), PageRequest.of(0, limit));
    }

    /**
     * Compare the bank system account with the sum of member bank balances.
     */
    @Transactional(readOnly = true)
    public BankReconciliation reconcile(String tenantId, String symbol) {
        Asset asset = assetService.getAsset(tenantId, symbol);
        String bankId = accountDirectory.systemAccountId(tenantId, AccountType.BANK);
        BigDecimal members = bankAccountRepository.findByTenantIdAndAssetId(tenantId, asset.getId()).stream()
            .map(BankAccount::getBalance)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BankReconciliation reconciliation =
            new BankReconciliation(asset.getSymbol(), ledgerService.balanceOf(bankId, asset.getId()), members);
        if (!reconciliation.isBalanced()) {
            log.error("Bank of tenant {} is out of balance for {}: ledger {}, members {}", tenantId,
                asset.getSymbol(), reconciliation.getLedgerBalance().toPlainString(), members.toPlainString());
        }
        return reconciliation;
    }

    private static List<String> lockKeys(String walletId, String bankId, Asset asset) {
        return List.of(
            AccountLockManager.balanceKey(walletId, asset.getId()),
            AccountLockManager.balanceKey(bankId, asset.getId()));
    }
}
