package com.guildledger.claims;

import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetCascade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class ClaimAssetCascade implements AssetCascade {

    private final PaymentClaimRepository claimRepository;

    @Override
    public Map<String, Long> deleteByAsset(Asset asset) {
        return Map.of("claims", (long) claimRepository.deleteByAssetId(asset.getId()));
    }
}
