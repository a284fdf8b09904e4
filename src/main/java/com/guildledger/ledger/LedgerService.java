package com.guildledger.ledger;

import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetRepository;
import com.guildledger.common.IdempotencyKey;
import com.guildledger.common.exception.AssetNotFoundException;
import com.guildledger.common.exception.UnbalancedTransactionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Journal and balance engine of the double-entry ledger.
 *
 * Postings are only accepted inside an active transaction. Every transaction
 * that receives postings is checked just before commit: if its postings do not
 * net to zero for every asset the commit is aborted and nothing is persisted.
 * The materialized balance of each (account, asset) pair is updated together
 * with its posting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private final LedgerTransactionRepository transactionRepository;
    private final LedgerEntryRepository entryRepository;
    private final AccountBalanceRepository balanceRepository;
    private final AssetRepository assetRepository;

    /**
     * Open a transaction header.
     *
     * @return the transaction id
     */
    @Transactional
    public String newTransaction(TransactionKind kind, String createdBy, String idempotencyKey, String reference) {
        if (kind == null) {
            throw new IllegalArgumentException("Transaction kind is required");
        }
        if (idempotencyKey != null) {
            IdempotencyKey.validate(idempotencyKey);
        }
        LedgerTransaction transaction = transactionRepository.save(
            new LedgerTransaction(kind, createdBy, idempotencyKey, reference));
        return transaction.getId();
    }

    /**
     * Append one posting and move the materialized balance with it.
     *
     * The amount must already be quantized to the asset's precision; it is
     * rejected rather than rounded.
     *
     * @throws IllegalStateException if no transaction is active
     */
    public void postEntry(String transactionId, String accountId, String assetId, BigDecimal amount) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Postings must be written inside an active transaction");
        }
        if (amount == null || amount.signum() == 0) {
            throw new IllegalArgumentException("Posting amount must be non-zero");
        }
        Asset asset = assetRepository.findById(assetId)
            .orElseThrow(() -> new AssetNotFoundException(assetId));
        if (!asset.fitsPrecision(amount)) {
            throw new IllegalArgumentException(String.format(
                "Amount %s exceeds the %d decimal places of %s",
                amount.toPlainString(), asset.getDecimals(), asset.getSymbol()));
        }

        entryRepository.save(new LedgerEntry(transactionId, accountId, assetId, amount));

        AccountBalance balance = balanceRepository.findForUpdate(accountId, assetId)
            .orElseGet(() -> new AccountBalance(accountId, assetId));
        balance.apply(amount);
        balanceRepository.save(balance);

        guardBalance(transactionId);
        log.debug("Posted {} {} to account {} in txn {}", amount.toPlainString(), asset.getSymbol(),
            accountId, transactionId);
    }

    /**
     * Current balance from the materialized index; zero when nothing was ever posted.
     */
    @Transactional(readOnly = true)
    public BigDecimal balanceOf(String accountId, String assetId) {
        return balanceRepository.findByAccountIdAndAssetId(accountId, assetId)
            .map(AccountBalance::getBalance)
            .orElse(BigDecimal.ZERO);
    }

    /**
     * Balance read under a row lock, for checks that precede a debit.
     */
    @Transactional
    public BigDecimal lockedBalanceOf(String accountId, String assetId) {
        return balanceRepository.findForUpdate(accountId, assetId)
            .map(AccountBalance::getBalance)
            .orElse(BigDecimal.ZERO);
    }

    /**
     * Balance recomputed from the postings, ignoring the materialized index.
     */
    @Transactional(readOnly = true)
    public BigDecimal replayBalance(String accountId, String assetId) {
        return entryRepository.findByAccountIdAndAssetId(accountId, assetId).stream()
            .map(LedgerEntry::getAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Overwrite the materialized balance with the replayed one.
     *
     * @return the replayed balance
     */
    @Transactional
    public BigDecimal rebuildBalance(String accountId, String assetId) {
        BigDecimal replayed = replayBalance(accountId, assetId);
        AccountBalance balance = balanceRepository.findForUpdate(accountId, assetId)
            .orElseGet(() -> new AccountBalance(accountId, assetId));
        if (balance.getBalance().compareTo(replayed) != 0) {
            log.warn("Materialized balance of account {} asset {} was {}, replay gives {}",
                accountId, assetId, balance.getBalance().toPlainString(), replayed.toPlainString());
        }
        balance.setBalance(replayed);
        balanceRepository.save(balance);
        return replayed;
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForTransaction(String transactionId) {
        return entryRepository.findByTransactionId(transactionId);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> entriesForAccount(String accountId) {
        return entryRepository.findByAccountIdOrderByCreatedAtDesc(accountId);
    }

    /**
     * Remove every posting and materialized balance of an asset.
     *
     * @return rows removed, keyed by table name
     */
    @Transactional
    public Map<String, Long> deleteAsset(String assetId) {
        long entries = entryRepository.deleteByAssetId(assetId);
        long balances = balanceRepository.deleteByAssetId(assetId);
        return Map.of("ledger_entries", entries, "account_balances", balances);
    }

    /**
     * Verify that the postings of a transaction net to zero for every asset.
     *
     * @throws UnbalancedTransactionException otherwise
     */
    public void assertBalanced(String transactionId) {
        Map<String, BigDecimal> imbalance = new TreeMap<>();
        for (LedgerEntry entry : entryRepository.findByTransactionId(transactionId)) {
            imbalance.merge(entry.getAssetId(), entry.getAmount(), BigDecimal::add);
        }
        imbalance.values().removeIf(sum -> sum.signum() == 0);
        if (!imbalance.isEmpty()) {
            log.error("Refusing to commit unbalanced transaction {}: {}", transactionId, imbalance);
            throw new UnbalancedTransactionException(transactionId, imbalance);
        }
    }

    private void guardBalance(String transactionId) {
        BalanceGuard guard = (BalanceGuard) TransactionSynchronizationManager.getResource(this);
        if (guard == null) {
            guard = new BalanceGuard();
            TransactionSynchronizationManager.bindResource(this, guard);
            TransactionSynchronizationManager.registerSynchronization(guard);
        }
        guard.transactionIds.add(transactionId);
    }

    /**
     * Checks the transactions posted in the current database transaction right before it commits.
     */
    private final class BalanceGuard implements TransactionSynchronization {

        private final Set<String> transactionIds = new LinkedHashSet<>();

        @Override
        public void suspend() {
            TransactionSynchronizationManager.unbindResource(LedgerService.this);
        }

        @Override
        public void resume() {
            TransactionSynchronizationManager.bindResource(LedgerService.this, this);
        }

        @Override
        public void beforeCommit(boolean readOnly) {
            transactionIds.forEach(LedgerService.this::assertBalanced);
        }

        @Override
        public void afterCompletion(int status) {
            TransactionSynchronizationManager.unbindResourceIfPossible(LedgerService.this);
        }
    }
}
