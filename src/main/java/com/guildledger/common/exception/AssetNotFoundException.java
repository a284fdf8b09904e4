package com.guildledger.common.exception;

/**
 * Thrown when a currency does not exist in a tenant.
 */
public class AssetNotFoundException extends GuildLedgerException {

    public AssetNotFoundException(String tenantId, String symbol) {
        super(String.format("Asset %s not found in tenant %s", symbol, tenantId));
    }

    public AssetNotFoundException(String assetId) {
        super("Asset not found: " + assetId);
    }
}
