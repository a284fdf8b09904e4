package com.guildledger.voice;

import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetCascade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class VcEarningAssetCascade implements AssetCascade {

    private final VcEarningRateRepository rateRepository;
    private final VcEarningDailyRepository dailyRepository;

    @Override
    public Map<String, Long> deleteByAsset(Asset asset) {
        Map<String, Long> deleted = new LinkedHashMap<>();
        deleted.put("vc_earning_daily", (long) dailyRepository.deleteByAssetId(asset.getId()));
        deleted.put("vc_earning_rates", (long) rateRepository.deleteByAssetId(asset.getId()));
        return deleted;
    }
}
