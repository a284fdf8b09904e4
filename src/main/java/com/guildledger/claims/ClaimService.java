package com.guildledger.claims;

import com.guildledger.accounts.AccountDirectory;
import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetService;
import com.guildledger.ledger.AccountLockManager;
import com.guildledger.ledger.JournalRequest;
import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.ledger.TransactionFactory;
import com.guildledger.ledger.TransactionKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * Payment requests between members.
 *
 * Paying a claim is a {@code claim_payment} transfer from payer to requester;
 * the claim turns paid in the same unit, keyed by the claim id so that it can
 * never be paid twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ClaimService {

    private final PaymentClaimRepository claimRepository;
    private final AssetService assetService;
    private final AccountDirectory accountDirectory;
    private final LedgerExecutor ledgerExecutor;
    private final TransactionFactory transactionFactory;
    private final Clock clock;

    public PaymentClaim request(String tenantId, String requesterId, String payerId, String symbol,
                                BigDecimal amount, String memo) {
        if (requesterId == null || requesterId.equals(payerId)) {
            throw new IllegalArgumentException("A claim needs two different members");
        }
        Asset asset = assetService.getAsset(tenantId, symbol);
        BigDecimal truncated = asset.truncatePositive(amount);
        PaymentClaim claim = claimRepository.save(
            new PaymentClaim(tenantId, payerId, requesterId, asset.getId(), truncated, memo));
        log.info("Claim {} raised by {} against {} for {} {}", claim.getId(), requesterId, payerId,
            truncated.toPlainString(), asset.getSymbol());
        return claim;
    }

    /**
     * Pay a pending claim.
     *
     * @throws IllegalArgumentException if {@code payerId} is not the member the claim is addressed to
     * @throws IllegalStateException if the claim is no longer pending
     */
    public PaymentClaim pay(String claimId, String payerId) {
        PaymentClaim snapshot = getClaim(claimId);
        requireParty(snapshot.getFromUserId(), payerId, claimId);
        String fromId = accountDirectory.ensureUserAccount(snapshot.getTenantId(), snapshot.getFromUserId());
        String toId = accountDirectory.ensureUserAccount(snapshot.getTenantId(), snapshot.getToUserId());

        List<String> lockKeys = List.of(
            claimKey(claimId),
            AccountLockManager.balanceKey(fromId, snapshot.getAssetId()),
            AccountLockManager.balanceKey(toId, snapshot.getAssetId()));
        PaymentClaim paid = ledgerExecutor.execute("pay claim", lockKeys, () -> {
            PaymentClaim claim = getClaim(claimId);
            claim.resolve(ClaimStatus.PAID, clock.instant());
            String transactionId = transactionFactory.record(JournalRequest.builder()
                .kind(TransactionKind.CLAIM_PAYMENT)
                .createdBy(payerId)
                .idempotencyKey("claim:" + claimId)
                .reference(claim.getMemo())
                .move(fromId, toId, claim.getAssetId(), claim.getAmount())
                .build());
            claim.setTransactionId(transactionId);
            return claimRepository.save(claim);
        });

        log.info("Claim {} paid by {}: txn={}", claimId, payerId, paid.getTransactionId());
        return paid;
    }

    public PaymentClaim decline(String claimId, String payerId) {
        return close(claimId, ClaimStatus.DECLINED, payerId);
    }

    public PaymentClaim cancel(String claimId, String requesterId) {
        return close(claimId, ClaimStatus.CANCELLED, requesterId);
    }

    /**
     * Pending claims a member has been asked to pay, oldest first.
     */
    @Transactional(readOnly = true)
    public List<PaymentClaim> pendingFor(String tenantId, String payerId) {
        return claimRepository.findByTenantIdAndFromUserIdAndStatusOrderByCreatedAtAsc(
            tenantId, payerId, ClaimStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public PaymentClaim getClaim(String claimId) {
        return claimRepository.findById(claimId)
            .orElseThrow(() -> new IllegalArgumentException("Claim not found: " + claimId));
    }

    private PaymentClaim close(String claimId, ClaimStatus status, String actorId) {
        return ledgerExecutor.execute(status.name().toLowerCase() + " claim", List.of(claimKey(claimId)), () -> {
            PaymentClaim claim = getClaim(claimId);
            String party = status == ClaimStatus.DECLINED ? claim.getFromUserId() : claim.getToUserId();
            requireParty(party, actorId, claimId);
            claim.resolve(status, clock.instant());
            log.info("Claim {} {} by {}", claimId, status.name().toLowerCase(), actorId);
            return claimRepository.save(claim);
        });
    }

    private static void requireParty(String expected, String actual, String claimId) {
        if (!expected.equals(actual)) {
            throw new IllegalArgumentException(String.format("User %s cannot act on claim %s", actual, claimId));
        }
    }

    private static String claimKey(String claimId) {
        return "claim:" + claimId;
    }
}
