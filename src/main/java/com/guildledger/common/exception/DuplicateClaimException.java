package com.guildledger.common.exception;

/**
 * Thrown when a user claims a one-time reward they already received.
 */
public class DuplicateClaimException extends GuildLedgerException {

    public DuplicateClaimException(String configId, String userId) {
        super(String.format("User %s already claimed reward %s", userId, configId));
    }
}
