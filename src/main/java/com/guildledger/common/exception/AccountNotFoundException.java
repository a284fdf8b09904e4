package com.guildledger.common.exception;

/**
 * Thrown when an account is not found.
 */
public class AccountNotFoundException extends GuildLedgerException {

    public AccountNotFoundException(String accountRef) {
        super("Account not found: " + accountRef);
    }
}
