package com.guildledger.roles;

import com.guildledger.ledger.LedgerExecutor;
import com.guildledger.providers.RoleGrantGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Takes back purchased roles once they expire.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RoleExpiryService {

    private final RolePurchaseRepository purchaseRepository;
    private final RoleGrantGateway roleGrantGateway;
    private final LedgerExecutor ledgerExecutor;

    /**
     * Revoke and delete every purchase with {@code expiresAt <= now}, one short unit per purchase.
     *
     * The role stays with the member while another purchase of it runs past
     * {@code now}. A revocation the platform rejects is logged and the record is
     * removed anyway, so a member who left the tenant does not block the sweep forever.
     *
     * @return number of purchases removed
     */
    public int sweep(Instant now) {
        List<RolePurchase> expired = purchaseRepository.findByExpiresAtLessThanEqualOrderByExpiresAtAsc(now);
        int removed = 0;
        for (RolePurchase purchase : expired) {
            if (stillHeld(purchase, now)) {
                log.debug("Keeping role {} of {} in tenant {}: another purchase is still active",
                    purchase.getRoleId(), purchase.getUserId(), purchase.getTenantId());
            } else {
                revoke(purchase);
            }

            try {
                boolean deleted = ledgerExecutor.execute("expire role purchase",
                    List.of("role-purchase:" + purchase.getId()), () -> {
                        if (!purchaseRepository.existsById(purchase.getId())) {
                            return false;
                        }
                        purchaseRepository.deleteById(purchase.getId());
                        return true;
                    });
                if (deleted) {
                    removed++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to remove expired role purchase {}", purchase.getId(), e);
            }
        }

        if (!expired.isEmpty()) {
            log.info("Role expiry sweep removed {} of {} expired purchases", removed, expired.size());
        }
        return removed;
    }

    private boolean stillHeld(RolePurchase purchase, Instant now) {
        return purchaseRepository.existsByTenantIdAndUserIdAndRoleIdAndExpiresAtAfter(
            purchase.getTenantId(), purchase.getUserId(), purchase.getRoleId(), now);
    }

    private void revoke(RolePurchase purchase) {
        try {
            roleGrantGateway.revokeRole(purchase.getTenantId(), purchase.getUserId(), purchase.getRoleId());
        } catch (RuntimeException e) {
            log.warn("Could not revoke role {} from {} in tenant {}: {}", purchase.getRoleId(),
                purchase.getUserId(), purchase.getTenantId(), e.getMessage());
        }
    }
}
