package com.guildledger.voice;

import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetCascade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drops plans priced in the asset and the records of channels opened from them.
 * The channels themselves are left to the expiry sweep's platform cleanup.
 */
@Component
@RequiredArgsConstructor
public class VcCreationAssetCascade implements AssetCascade {

    private final VcCreationPlanRepository planRepository;
    private final VcCreationRepository creationRepository;

    @Override
    public Map<String, Long> deleteByAsset(Asset asset) {
        Map<String, Long> deleted = new LinkedHashMap<>();
        deleted.put("vc_creations", (long) creationRepository.deleteByAssetId(asset.getId()));
        deleted.put("vc_creation_plans", (long) planRepository.deleteByAssetId(asset.getId()));
        return deleted;
    }
}
