package com.guildledger.rewards;

import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetCascade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class AutoRewardAssetCascade implements AssetCascade {

    private final AutoRewardConfigRepository configRepository;
    private final AutoRewardClaimRepository claimRepository;

    @Override
    public Map<String, Long> deleteByAsset(Asset asset) {
        List<AutoRewardConfig> configs = configRepository.findByAssetId(asset.getId());
        Map<String, Long> deleted = new LinkedHashMap<>();
        long claims = configs.isEmpty() ? 0
            : claimRepository.deleteByConfigIdIn(configs.stream().map(AutoRewardConfig::getId).toList());
        deleted.put("auto_reward_claims", claims);
        configRepository.deleteAllInBatch(configs);
        deleted.put("auto_reward_configs", (long) configs.size());
        return deleted;
    }
}
