package com.guildledger.accounts;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kinds of ledger participant.
 */
public enum AccountType {

    /** A member of a tenant. */
    USER("user", true),

    /** Issuing authority; refilled automatically, never checked for funds. */
    TREASURY("treasury", false),

    /** Sink for value removed from circulation. */
    BURN("burn", false),

    /**
     * Contra account for minted supply. Every treasury refill debits it, so its
     * balance is the negated total ever minted.
     */
    MINT("mint", false),

    /** Holds everything deposited in the bank subledger. */
    BANK("bank", true),

    /** Holds betting stakes until an event is settled or cancelled. */
    ESCROW("escrow", true);

    private final String code;
    private final boolean fundsChecked;

    AccountType(String code, boolean fundsChecked) {
        this.code = code;
        this.fundsChecked = fundsChecked;
    }

    public String getCode() {
        return code;
    }

    /**
     * Whether a debit must be covered by the current balance.
     */
    public boolean isFundsChecked() {
        return fundsChecked;
    }

    public boolean isSystem() {
        return this != USER;
    }

    public static AccountType fromCode(String code) {
        String normalized = code == null ? "" : code.strip().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.code.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown account type: " + code));
    }
}
