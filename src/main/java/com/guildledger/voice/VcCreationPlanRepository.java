package com.guildledger.voice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VcCreationPlanRepository extends JpaRepository<VcCreationPlan, String> {

    Optional<VcCreationPlan> findByTenantIdAndName(String tenantId, String name);

    List<VcCreationPlan> findByTenantIdOrderByTemplateNameAscNameAsc(String tenantId);

    List<VcCreationPlan> findByTenantIdAndTemplateNameOrderByNameAsc(String tenantId, String templateName);

    @Modifying
    @Query("delete from VcCreationPlan p where p.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
