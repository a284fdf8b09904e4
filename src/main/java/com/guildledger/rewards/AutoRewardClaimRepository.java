package com.guildledger.rewards;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;

/**
 * Repository for auto-reward claims.
 */
@Repository
public interface AutoRewardClaimRepository extends JpaRepository<AutoRewardClaim, String> {

    boolean existsByConfigIdAndUserId(String configId, String userId);

    long countByConfigId(String configId);

    @Modifying
    @Query("delete from AutoRewardClaim c where c.configId in :configIds")
    int deleteByConfigIdIn(@Param("configIds") Collection<String> configIds);
}
