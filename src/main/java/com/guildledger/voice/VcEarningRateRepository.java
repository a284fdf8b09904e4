package com.guildledger.voice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VcEarningRateRepository extends JpaRepository<VcEarningRate, String> {

    Optional<VcEarningRate> findByTenantIdAndCategoryIdAndAssetId(String tenantId, String categoryId, String assetId);

    List<VcEarningRate> findByTenantIdAndCategoryId(String tenantId, String categoryId);

    List<VcEarningRate> findByTenantIdOrderByCategoryIdAsc(String tenantId);

    @Modifying
    @Query("delete from VcEarningRate r where r.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
