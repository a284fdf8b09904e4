package com.guildledger.allowance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MonthlyAllowanceRepository extends JpaRepository<MonthlyAllowance, String> {

    Optional<MonthlyAllowance> findByTenantIdAndRoleIdAndAssetId(String tenantId, String roleId, String assetId);

    List<MonthlyAllowance> findByTenantIdOrderByCreatedAtAsc(String tenantId);

    List<MonthlyAllowance> findByEnabledTrue();

    @Modifying
    @Query("delete from MonthlyAllowance a where a.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
