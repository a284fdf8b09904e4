package com.guildledger.common.exception;

/**
 * Thrown when a currency symbol is already taken in a tenant.
 */
public class DuplicateAssetException extends GuildLedgerException {

    public DuplicateAssetException(String tenantId, String symbol) {
        super(String.format("Asset %s already exists in tenant %s", symbol, tenantId));
    }
}
