package com.guildledger.voice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface VcEarningDailyRepository extends JpaRepository<VcEarningDaily, String> {

    Optional<VcEarningDaily> findByTenantIdAndUserIdAndAssetIdAndEarnedOn(
        String tenantId, String userId, String assetId, LocalDate earnedOn);

    @Modifying
    @Query("delete from VcEarningDaily d where d.earnedOn < :cutoff")
    int deleteByEarnedOnBefore(@Param("cutoff") LocalDate cutoff);

    @Modifying
    @Query("delete from VcEarningDaily d where d.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
