package com.guildledger.ledger;

import com.guildledger.accounts.Account;
import com.guildledger.accounts.AccountDirectory;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetRepository;
import com.guildledger.common.exception.AssetNotFoundException;
import com.guildledger.common.exception.InsufficientBalanceException;
import com.guildledger.common.exception.UnbalancedTransactionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a {@link JournalRequest} into exactly one transaction with its postings.
 *
 * All validation (balance per asset, idempotency, funds) happens before the
 * first row is written. Must be called inside a unit that holds the locks of
 * every debited (account, asset) pair.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TransactionFactory {

    private final LedgerService ledgerService;
    private final LedgerTransactionRepository transactionRepository;
    private final AccountDirectory accountDirectory;
    private final AssetRepository assetRepository;

    /**
     * Record the request.
     *
     * @return id of the new transaction, or of the existing one when the
     *         (kind, idempotency key) pair was already recorded
     * @throws UnbalancedTransactionException if the legs do not net to zero per asset
     * @throws InsufficientBalanceException if a regular account cannot cover its debit
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public String record(JournalRequest request) {
        if (request.getKind() == null) {
            throw new IllegalArgumentException("Transaction kind is required");
        }
        if (request.getLegs().isEmpty()) {
            throw new IllegalArgumentException("A transaction needs at least one posting");
        }

        Map<String, BigDecimal> imbalance = new LinkedHashMap<>(request.netByAsset());
        imbalance.values().removeIf(net -> net.signum() == 0);
        if (!imbalance.isEmpty()) {
            log.error("Rejecting unbalanced {} request: {}", request.getKind().getCode(), imbalance);
            throw new UnbalancedTransactionException("(unwritten)", imbalance);
        }

        if (request.getIdempotencyKey() != null) {
            Optional<LedgerTransaction> existing = findExisting(request.getKind(), request.getIdempotencyKey());
            if (existing.isPresent()) {
                log.info("Duplicate {} request with idempotency key {}",
                    request.getKind().getCode(), request.getIdempotencyKey());
                return existing.get().getId();
            }
        }

        checkFunds(request.getLegs());

        String transactionId = ledgerService.newTransaction(request.getKind(), request.getCreatedBy(),
            request.getIdempotencyKey(), request.getReference());
        for (JournalRequest.Leg leg : request.getLegs()) {
            if (leg.getAmount().signum() != 0) {
                ledgerService.postEntry(transactionId, leg.getAccountId(), leg.getAssetId(), leg.getAmount());
            }
        }

        log.info("Recorded {}: txn={}, legs={}", request.getKind().getCode(), transactionId, request.getLegs().size());
        return transactionId;
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findExisting(TransactionKind kind, String idempotencyKey) {
        return transactionRepository.findByKindAndIdempotencyKey(kind, idempotencyKey);
    }

    private void checkFunds(List<JournalRequest.Leg> legs) {
        Map<List<String>, BigDecimal> netByPair = new LinkedHashMap<>();
        for (JournalRequest.Leg leg : legs) {
            netByPair.merge(List.of(leg.getAccountId(), leg.getAssetId()), leg.getAmount(), BigDecimal::add);
        }

        for (Map.Entry<List<String>, BigDecimal> pair : netByPair.entrySet()) {
            BigDecimal net = pair.getValue();
            if (net.signum() >= 0) {
                continue;
            }
            String accountId = pair.getKey().get(0);
            String assetId = pair.getKey().get(1);
            Account account = accountDirectory.getAccount(accountId);
            if (!account.getType().isFundsChecked()) {
                continue;
            }
            BigDecimal available = ledgerService.lockedBalanceOf(accountId, assetId);
            BigDecimal required = net.negate();
            if (available.compareTo(required) < 0) {
                Asset asset = assetRepository.findById(assetId)
                    .orElseThrow(() -> new AssetNotFoundException(assetId));
                throw new InsufficientBalanceException(accountId, asset.getSymbol(), required, available);
            }
        }
    }
}
