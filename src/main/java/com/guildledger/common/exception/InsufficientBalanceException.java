package com.guildledger.common.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Thrown when a debit would take a regular account below zero.
 */
@Getter
public class InsufficientBalanceException extends GuildLedgerException {

    private final String accountId;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientBalanceException(String accountId, String symbol, BigDecimal required, BigDecimal available) {
        super(String.format("Insufficient balance in account %s. Required: %s %s, Available: %s %s",
            accountId,
            required.toPlainString(), symbol,
            available.toPlainString(), symbol));
        this.accountId = accountId;
        this.required = required;
        this.available = available;
    }
}
