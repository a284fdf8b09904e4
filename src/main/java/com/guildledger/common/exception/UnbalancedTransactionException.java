package com.guildledger.common.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Thrown when the postings of a transaction do not net to zero for every asset.
 *
 * Always a programming error in the caller that built the postings.
 */
@Getter
public class UnbalancedTransactionException extends GuildLedgerException {

    private final String transactionId;
    private final Map<String, BigDecimal> imbalanceByAsset;

    public UnbalancedTransactionException(String transactionId, Map<String, BigDecimal> imbalanceByAsset) {
        super(String.format("Transaction %s is not balanced: %s", transactionId, imbalanceByAsset));
        this.transactionId = transactionId;
        this.imbalanceByAsset = Map.copyOf(imbalanceByAsset);
    }
}
