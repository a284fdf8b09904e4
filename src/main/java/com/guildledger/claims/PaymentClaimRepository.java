package com.guildledger.claims;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for payment claims.
 */
@Repository
public interface PaymentClaimRepository extends JpaRepository<PaymentClaim, String> {

    List<PaymentClaim> findByTenantIdAndFromUserIdAndStatusOrderByCreatedAtAsc(
        String tenantId, String fromUserId, ClaimStatus status);

    List<PaymentClaim> findByTenantIdAndToUserIdOrderByCreatedAtDesc(String tenantId, String toUserId);

    @Modifying
    @Query("delete from PaymentClaim c where c.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
