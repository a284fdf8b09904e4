package com.guildledger.assets;

import lombok.Value;

import java.util.Map;

/**
 * Rows removed per table when a currency was deleted.
 */
@Value
public class AssetDeletionSummary {
    String assetId;
    String symbol;
    Map<String, Long> deletedRows;

    public long getDeletedRows(String table) {
        return deletedRows.getOrDefault(table, 0L);
    }
}
