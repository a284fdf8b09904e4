package com.guildledger.betting;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BettingEventRepository extends JpaRepository<BettingEvent, String> {

    Optional<BettingEvent> findFirstByTenantIdAndStatus(String tenantId, BettingStatus status);

    List<BettingEvent> findByAssetId(String assetId);

    @Modifying
    @Query("delete from BettingEvent e where e.assetId = :assetId")
    int deleteByAssetId(@Param("assetId") String assetId);
}
