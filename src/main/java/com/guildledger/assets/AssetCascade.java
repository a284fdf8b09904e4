package com.guildledger.assets;

import java.util.Map;

/**
 * Rows in a subledger that reference an asset and must disappear with it.
 *
 * Every implementation is invoked inside the single transaction that deletes
 * the asset, so either all of them succeed or none of their deletes persist.
 */
public interface AssetCascade {

    /**
     * Delete every row that references the asset.
     *
     * @return rows removed, keyed by table name
     */
    Map<String, Long> deleteByAsset(Asset asset);
}
