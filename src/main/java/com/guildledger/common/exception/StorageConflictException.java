package com.guildledger.common.exception;

/**
 * Thrown when an atomic unit keeps losing to concurrent writers.
 * Transient: the caller may try again later.
 */
public class StorageConflictException extends GuildLedgerException {

    public StorageConflictException(String operation, Throwable cause) {
        super("Storage conflict during " + operation, cause);
    }

    public StorageConflictException(String message) {
        super(message);
    }
}
