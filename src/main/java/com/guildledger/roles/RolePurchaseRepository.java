package com.guildledger.roles;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface RolePurchaseRepository extends JpaRepository<RolePurchase, String> {

    List<RolePurchase> findByExpiresAtLessThanEqualOrderByExpiresAtAsc(Instant now);

    List<RolePurchase> findByTenantIdAndUserIdOrderByExpiresAtAsc(String tenantId, String userId);

    boolean existsByTenantIdAndUserIdAndRoleIdAndExpiresAtAfter(String tenantId, String userId, String roleId,
                                                                Instant now);

    @Modifying
    @Query("delete from RolePurchase p where p.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
