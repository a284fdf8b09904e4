package com.guildledger.common.exception;

/**
 * Base exception for all ledger exceptions.
 */
public class GuildLedgerException extends RuntimeException {

    public GuildLedgerException(String message) {
        super(message);
    }

    public GuildLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
