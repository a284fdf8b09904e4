package com.guildledger.roles;

import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetCascade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class RoleShopAssetCascade implements AssetCascade {

    private final RolePanelRepository panelRepository;
    private final RolePlanRepository planRepository;
    private final RolePurchaseRepository purchaseRepository;

    @Override
    public Map<String, Long> deleteByAsset(Asset asset) {
        Map<String, Long> deleted = new LinkedHashMap<>();
        deleted.put("role_purchases", (long) purchaseRepository.deleteByAssetId(asset.getId()));
        deleted.put("role_plans", (long) planRepository.deleteByAssetId(asset.getId()));
        deleted.put("role_panels", (long) panelRepository.deleteByAssetId(asset.getId()));
        return deleted;
    }
}
