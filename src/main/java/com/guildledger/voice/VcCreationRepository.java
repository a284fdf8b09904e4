package com.guildledger.voice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface VcCreationRepository extends JpaRepository<VcCreation, String> {

    List<VcCreation> findByExpiresAtLessThanEqualOrderByExpiresAtAsc(Instant now);

    List<VcCreation> findByTenantIdAndOwnerUserIdOrderByExpiresAtAsc(String tenantId, String ownerUserId);

    long countByPlanId(String planId);

    @Modifying
    @Query("delete from VcCreation c where c.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
