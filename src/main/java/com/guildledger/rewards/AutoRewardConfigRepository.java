package com.guildledger.rewards;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for auto-reward configs.
 */
@Repository
public interface AutoRewardConfigRepository extends JpaRepository<AutoRewardConfig, String> {

    Optional<AutoRewardConfig> findByTenantIdAndChannelId(String tenantId, String channelId);

    List<AutoRewardConfig> findByTenantIdOrderByCreatedAtAsc(String tenantId);

    List<AutoRewardConfig> findByAssetId(String assetId);
}
