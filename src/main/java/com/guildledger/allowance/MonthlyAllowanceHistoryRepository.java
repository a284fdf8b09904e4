package com.guildledger.allowance;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MonthlyAllowanceHistoryRepository extends JpaRepository<MonthlyAllowanceHistory, String> {

    boolean existsByTenantIdAndRoleIdAndUserIdAndAssetIdAndYearMonth(
        String tenantId, String roleId, String userId, String assetId, String yearMonth);

    List<MonthlyAllowanceHistory> findByTenantIdAndYearMonthOrderByPaidAtAsc(String tenantId, String yearMonth);

    @Modifying
    @Query("delete from MonthlyAllowanceHistory h where h.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
