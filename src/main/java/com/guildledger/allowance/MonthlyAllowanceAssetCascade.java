package com.guildledger.allowance;

import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetCascade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class MonthlyAllowanceAssetCascade implements AssetCascade {

    private final MonthlyAllowanceRepository allowanceRepository;
    private final MonthlyAllowanceHistoryRepository historyRepository;

    @Override
    public Map<String, Long> deleteByAsset(Asset asset) {
        Map<String, Long> deleted = new LinkedHashMap<>();
        deleted.put("monthly_allowance_history", (long) historyRepository.deleteByAssetId(asset.getId()));
        deleted.put("monthly_allowances", (long) allowanceRepository.deleteByAssetId(asset.getId()));
        return deleted;
    }
}
