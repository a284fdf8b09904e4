package com.guildledger.bank;

import com.guildledger.assets.Asset;
import com.guildledger.assets.AssetCascade;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class BankAssetCascade implements AssetCascade {

    private final BankAccountRepository bankAccountRepository;
    private final BankTransactionRepository bankTransactionRepository;

    @Override
    public Map<String, Long> deleteByAsset(Asset asset) {
        Map<String, Long> deleted = new LinkedHashMap<>();
        deleted.put("bank_transactions", (long) bankTransactionRepository.deleteByAssetId(asset.getId()));
        deleted.put("bank_accounts", (long) bankAccountRepository.deleteByAssetId(asset.getId()));
        return deleted;
    }
}
